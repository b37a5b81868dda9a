package com.github.salilvnair.researchengine.integration;

import com.github.salilvnair.researchengine.engine.model.ConversationTurn;
import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.Query;
import com.github.salilvnair.researchengine.integration.digest.ResearchDigest;
import com.github.salilvnair.researchengine.template.ThymeleafTemplateRenderer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the answer prompt. Output depends only on the arguments, so equal inputs give the
 * same prompt text.
 */
@Component
@RequiredArgsConstructor
public class ResponsePromptBuilder {

    static final String RESPONSE_TEMPLATE = """
            You are a professional academic research assistant. Answer the user's question using only the research data below.
            Mention paper titles and researcher names exactly as they appear in the data.

            User query: {{query}}
            Intent: {{intentType}} (confidence {{confidence}})
            Response strategy: {{strategy}}

            Recent conversation:
            {{history}}

            Research data:
            {{researchData}}

            {{availability}}
            Instructions: {{instructions}}
            """;

    private static final int MAX_HISTORY_CHARS = 300;

    private final ThymeleafTemplateRenderer renderer;
    private final DigestFormatter digestFormatter;

    public String build(Query query, Intent intent, ResearchDigest digest, List<ConversationTurn> conversation) {
        ResponseStrategy strategy = ResponseStrategy.forIntent(intent.type());
        String researchData = digestFormatter.format(digest);

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("query", query.text());
        variables.put("intentType", intent.type().code());
        variables.put("confidence", String.format(Locale.ROOT, "%.2f", intent.confidence()));
        variables.put("strategy", strategy.code());
        variables.put("history", history(conversation));
        variables.put("researchData", researchData.isBlank() ? "No matching records were returned." : researchData);
        variables.put("availability", digest.unavailableSources().isEmpty()
                ? "All data sources responded."
                : "Some data sources were unavailable; say that the answer may be incomplete without naming internal errors.");
        variables.put("instructions", strategy.instructions());
        return renderer.render(RESPONSE_TEMPLATE, variables);
    }

    private String history(List<ConversationTurn> conversation) {
        if (conversation == null || conversation.isEmpty()) {
            return "(none)";
        }
        return conversation.stream()
                .map(turn -> turn.role().name().toLowerCase(Locale.ROOT) + ": " + abbreviate(turn.content()))
                .collect(Collectors.joining("\n"));
    }

    private static String abbreviate(String content) {
        String text = content == null ? "" : content.replaceAll("\\s+", " ").trim();
        return text.length() <= MAX_HISTORY_CHARS ? text : text.substring(0, MAX_HISTORY_CHARS) + "...";
    }
}
