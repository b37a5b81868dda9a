package com.github.salilvnair.researchengine.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.researchengine.config.ResearchEngineLlmConfig;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import com.github.salilvnair.researchengine.engine.model.ConversationTurn;
import com.github.salilvnair.researchengine.engine.model.IntentType;
import com.github.salilvnair.researchengine.llm.core.LlmClient;
import com.github.salilvnair.researchengine.llm.core.LlmGenerationOptions;
import com.github.salilvnair.researchengine.template.ThymeleafTemplateRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Asks the language model to classify queries the patterns could not place.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmIntentClassifier {

    static final String PROMPT_TEMPLATE = """
            Classify the academic research query into exactly one intent.
            Allowed intents: search_papers, author_info, citation_analysis, trend_analysis, keyword_analysis, unknown.
            Parameters: search_papers -> keywords (list of strings); author_info -> author_name;
            citation_analysis -> paper_id or paper_title; trend_analysis -> field, time_range; keyword_analysis -> field, limit.
            Recent conversation:
            {{history}}
            Query: {{query}}
            Answer with JSON only: {"intent_type": "...", "confidence": 0.0, "parameters": {}}
            """;

    private static final Map<String, IntentType> ALIASES = Map.of(
            "search_authors", IntentType.AUTHOR_INFO,
            "get_author_details", IntentType.AUTHOR_INFO,
            "get_author_papers", IntentType.AUTHOR_INFO,
            "get_paper_details", IntentType.CITATION_ANALYSIS,
            "get_paper_citations", IntentType.CITATION_ANALYSIS,
            "get_trending_papers", IntentType.TREND_ANALYSIS,
            "research_trends", IntentType.TREND_ANALYSIS,
            "get_top_keywords", IntentType.KEYWORD_ANALYSIS
    );

    private final LlmClient llmClient;
    private final ResearchEngineLlmConfig llmConfig;
    private final ThymeleafTemplateRenderer renderer;
    private final ObjectMapper mapper;

    public Optional<ModelIntentSignal> classify(String text, List<ConversationTurn> recentTurns) {
        String history = recentTurns == null || recentTurns.isEmpty()
                ? "(none)"
                : recentTurns.stream()
                    .map(turn -> turn.role().name().toLowerCase(Locale.ROOT) + ": " + turn.content())
                    .collect(Collectors.joining("\n"));
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("history", history);
        variables.put("query", text);
        try {
            String answer = llmClient.generate(renderer.render(PROMPT_TEMPLATE, variables),
                    LlmGenerationOptions.forIntent(llmConfig));
            return parse(answer);
        } catch (ResearchEngineException e) {
            log.warn("LLM intent classification failed errorCode={} message={}", e.getErrorCode(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("LLM intent classification failed unexpectedly", e);
            return Optional.empty();
        }
    }

    Optional<ModelIntentSignal> parse(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.warn("LLM intent answer carried no JSON object");
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(answer.substring(start, end + 1));
            String rawType = node.path("intent_type").asText("");
            IntentType type = ALIASES.getOrDefault(rawType, IntentType.fromCode(rawType));
            double confidence = node.path("confidence").asDouble(0.0d);
            Map<String, Object> parameters = node.path("parameters").isObject()
                    ? mapper.convertValue(node.get("parameters"), new TypeReference<LinkedHashMap<String, Object>>() {})
                    : Map.of();
            return Optional.of(new ModelIntentSignal(type, confidence, parameters));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("LLM intent answer could not be parsed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
