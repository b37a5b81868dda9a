package com.github.salilvnair.researchengine.dispatch;

public final class ToolNames {

    private ToolNames() {
    }

    public static final String SEARCH_PAPERS = "search_papers";
    public static final String GET_PAPER_DETAILS = "get_paper_details";
    public static final String GET_PAPER_CITATIONS = "get_paper_citations";
    public static final String GET_CITATION_NETWORK = "get_citation_network";
    public static final String SEARCH_AUTHORS = "search_authors";
    public static final String GET_AUTHOR_PAPERS = "get_author_papers";
    public static final String GET_COLLABORATION_NETWORK = "get_collaboration_network";
    public static final String GET_TRENDING_PAPERS = "get_trending_papers";
    public static final String GET_TOP_KEYWORDS = "get_top_keywords";
    public static final String GET_RESEARCH_TRENDS = "get_research_trends";
}
