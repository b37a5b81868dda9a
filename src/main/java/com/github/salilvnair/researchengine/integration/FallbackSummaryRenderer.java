package com.github.salilvnair.researchengine.integration;

import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.Query;
import com.github.salilvnair.researchengine.integration.digest.ResearchDigest;
import com.github.salilvnair.researchengine.template.ThymeleafTemplateRenderer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Templated answers that need no language model: the structured summary used when generation
 * fails, the clarification for unrecognised queries and the generic error message.
 */
@Component
@RequiredArgsConstructor
public class FallbackSummaryRenderer {

    static final String SUMMARY_TEMPLATE = """
            Here is what I found for "{{query}}".

            {{researchData}}
            {{availability}}""";

    static final String CLARIFICATION_TEMPLATE = """
            I'm not sure what research information you are looking for with "{{query}}".
            I can search papers by topic, look up researchers and their collaborators, analyse citations of a paper, \
            and report research trends or top keywords. Could you rephrase your question?""";

    static final String ERROR_MESSAGE =
            "Sorry, the research data service is currently unavailable so I could not answer this question. Please try again later.";

    static final String PARTIAL_NOTE = "Some data sources were unavailable, so this answer may be incomplete.";

    private final ThymeleafTemplateRenderer renderer;
    private final DigestFormatter digestFormatter;

    public String summary(Query query, Intent intent, ResearchDigest digest) {
        String researchData = digestFormatter.format(digest);
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("query", query.text());
        variables.put("intentType", intent.type().code());
        variables.put("researchData", researchData.isBlank() ? "No matching records were returned." : researchData);
        variables.put("availability", digest.unavailableSources().isEmpty() ? "" : "\n" + PARTIAL_NOTE);
        return renderer.render(SUMMARY_TEMPLATE, variables).trim();
    }

    public String clarification(Query query) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("query", query.text());
        return renderer.render(CLARIFICATION_TEMPLATE, variables).trim();
    }

    public String error() {
        return ERROR_MESSAGE;
    }
}
