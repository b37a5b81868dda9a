package com.github.salilvnair.researchengine.integration;

import com.github.salilvnair.researchengine.engine.model.IntentType;

import java.util.List;

public enum ResponseStrategy {

    PAPER_LIST("paper_list",
            "List the most relevant papers with title, authors, year and citation count, then summarise the common themes.",
            List.of("View detailed information of a specific paper",
                    "Analyze an author's other works",
                    "Explore related research trends")),

    AUTHOR_PROFILE("author_profile",
            "Describe the researcher's affiliation, research areas and impact, then highlight notable papers and collaborators.",
            List.of("View the author's most cited papers",
                    "Analyze the author's collaboration network",
                    "Explore trends in the author's research areas")),

    CITATION_ANALYSIS("citation_analysis",
            "Explain the paper's influence: who cites it, how large its citation network is and which citing works stand out.",
            List.of("See the full details of a citing paper",
                    "Look up the authors of this paper",
                    "Compare with related papers on the same topic")),

    TREND_REPORT("trend_report",
            "Summarise the trending papers and keywords, name the emerging directions and how they are changing over time.",
            List.of("Deep dive into a specific research direction",
                    "Compare trends across different time periods",
                    "Find papers about an emerging topic")),

    KEYWORD_ANALYSIS("keyword_analysis",
            "Rank the most frequent keywords, group related ones and explain what they say about the field.",
            List.of("Search papers for one of these keywords",
                    "See how these keywords trend over time",
                    "Find researchers working on a keyword")),

    CLARIFICATION("clarification",
            "Ask the user to clarify what research information they need.",
            List.of("Search for papers on a specific topic, e.g. \"Find papers about deep learning\"",
                    "Look up a researcher, e.g. \"Who is Yoshua Bengio?\"",
                    "Ask for trends or top keywords in a field"));

    private final String code;
    private final String instructions;
    private final List<String> suggestions;

    ResponseStrategy(String code, String instructions, List<String> suggestions) {
        this.code = code;
        this.instructions = instructions;
        this.suggestions = suggestions;
    }

    public String code() {
        return code;
    }

    public String instructions() {
        return instructions;
    }

    public List<String> suggestions() {
        return suggestions;
    }

    public static ResponseStrategy forIntent(IntentType type) {
        return switch (type) {
            case SEARCH_PAPERS -> PAPER_LIST;
            case AUTHOR_INFO -> AUTHOR_PROFILE;
            case CITATION_ANALYSIS -> CITATION_ANALYSIS;
            case TREND_ANALYSIS -> TREND_REPORT;
            case KEYWORD_ANALYSIS -> KEYWORD_ANALYSIS;
            case UNKNOWN -> CLARIFICATION;
        };
    }
}
