package com.github.salilvnair.researchengine.dispatch;

import com.github.salilvnair.researchengine.config.ResearchEngineDispatchConfig;
import com.github.salilvnair.researchengine.engine.mcp.payload.ToolPayloadReader;
import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.IntentType;
import com.github.salilvnair.researchengine.engine.model.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.salilvnair.researchengine.dispatch.ToolNames.GET_AUTHOR_PAPERS;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.GET_CITATION_NETWORK;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.GET_COLLABORATION_NETWORK;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.GET_PAPER_CITATIONS;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.GET_PAPER_DETAILS;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.GET_RESEARCH_TRENDS;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.GET_TOP_KEYWORDS;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.GET_TRENDING_PAPERS;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.SEARCH_AUTHORS;
import static com.github.salilvnair.researchengine.dispatch.ToolNames.SEARCH_PAPERS;

/**
 * The only place that maps an intent to data service tools.
 */
@Component
@RequiredArgsConstructor
public class ToolDispatchTable {

    private final ResearchEngineDispatchConfig config;
    private final ToolPayloadReader payloadReader;

    public ToolPlan planFor(IntentType type) {
        return switch (type) {
            case SEARCH_PAPERS -> new ToolPlan(type, List.of(
                    ToolStage.of(new ToolStep(SEARCH_PAPERS, this::searchPapers))));
            case AUTHOR_INFO -> new ToolPlan(type, List.of(
                    ToolStage.of(new ToolStep(SEARCH_AUTHORS, this::searchAuthors)),
                    ToolStage.of(
                            new ToolStep(GET_AUTHOR_PAPERS, this::authorPapers),
                            new ToolStep(GET_COLLABORATION_NETWORK, this::collaborationNetwork))));
            case CITATION_ANALYSIS -> new ToolPlan(type, List.of(
                    ToolStage.of(new ToolStep(GET_PAPER_DETAILS, this::paperDetails)),
                    ToolStage.of(
                            new ToolStep(GET_PAPER_CITATIONS, this::paperCitations),
                            new ToolStep(GET_CITATION_NETWORK, this::citationNetwork))));
            case TREND_ANALYSIS -> new ToolPlan(type, List.of(
                    ToolStage.of(
                            new ToolStep(GET_TRENDING_PAPERS, this::trendWindow),
                            new ToolStep(GET_TOP_KEYWORDS, this::topKeywords),
                            new ToolStep(GET_RESEARCH_TRENDS, this::trendWindow))));
            case KEYWORD_ANALYSIS -> new ToolPlan(type, List.of(
                    ToolStage.of(new ToolStep(GET_TOP_KEYWORDS, this::topKeywords))));
            case UNKNOWN -> ToolPlan.none(type);
        };
    }

    private Optional<Map<String, Object>> searchPapers(Intent intent, List<ToolResult> earlier) {
        List<String> keywords = intent.listParam(Intent.KEYWORDS);
        if (keywords.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("query", String.join(" ", keywords));
        arguments.put("limit", limit(intent, config.getDefaultSearchLimit()));
        if (intent.intParam(Intent.YEAR_FROM) != null) {
            arguments.put("year_from", intent.intParam(Intent.YEAR_FROM));
        }
        return Optional.of(arguments);
    }

    private Optional<Map<String, Object>> searchAuthors(Intent intent, List<ToolResult> earlier) {
        String authorName = intent.stringParam(Intent.AUTHOR_NAME);
        if (authorName == null) {
            return Optional.empty();
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("query", authorName);
        arguments.put("limit", config.getDefaultSearchLimit());
        return Optional.of(arguments);
    }

    private Optional<Map<String, Object>> authorPapers(Intent intent, List<ToolResult> earlier) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        Optional<String> authorId = resultOf(earlier, SEARCH_AUTHORS).flatMap(payloadReader::firstAuthorId);
        if (authorId.isPresent()) {
            arguments.put("author_id", authorId.get());
        } else if (intent.stringParam(Intent.AUTHOR_NAME) != null) {
            arguments.put("author_name", intent.stringParam(Intent.AUTHOR_NAME));
        } else {
            return Optional.empty();
        }
        arguments.put("limit", config.getAuthorPaperLimit());
        return Optional.of(arguments);
    }

    private Optional<Map<String, Object>> collaborationNetwork(Intent intent, List<ToolResult> earlier) {
        return resultOf(earlier, SEARCH_AUTHORS)
                .flatMap(payloadReader::firstAuthorId)
                .map(authorId -> {
                    Map<String, Object> arguments = new LinkedHashMap<>();
                    arguments.put("author_id", authorId);
                    arguments.put("depth", config.getNetworkDepth());
                    return arguments;
                });
    }

    private Optional<Map<String, Object>> paperDetails(Intent intent, List<ToolResult> earlier) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (intent.stringParam(Intent.PAPER_ID) != null) {
            arguments.put("paper_id", intent.stringParam(Intent.PAPER_ID));
        } else if (intent.stringParam(Intent.PAPER_TITLE) != null) {
            arguments.put("title", intent.stringParam(Intent.PAPER_TITLE));
        } else {
            return Optional.empty();
        }
        return Optional.of(arguments);
    }

    private Optional<Map<String, Object>> paperCitations(Intent intent, List<ToolResult> earlier) {
        return resolvedPaperId(intent, earlier).map(paperId -> {
            Map<String, Object> arguments = new LinkedHashMap<>();
            arguments.put("paper_id", paperId);
            return arguments;
        });
    }

    private Optional<Map<String, Object>> citationNetwork(Intent intent, List<ToolResult> earlier) {
        return resolvedPaperId(intent, earlier).map(paperId -> {
            Map<String, Object> arguments = new LinkedHashMap<>();
            arguments.put("paper_id", paperId);
            arguments.put("depth", config.getNetworkDepth());
            return arguments;
        });
    }

    private Optional<Map<String, Object>> trendWindow(Intent intent, List<ToolResult> earlier) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (intent.stringParam(Intent.FIELD) != null) {
            arguments.put("field", intent.stringParam(Intent.FIELD));
        }
        String timeRange = intent.stringParam(Intent.TIME_RANGE);
        arguments.put("time_range", timeRange == null ? config.getDefaultTimeRange() : timeRange);
        return Optional.of(arguments);
    }

    private Optional<Map<String, Object>> topKeywords(Intent intent, List<ToolResult> earlier) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (intent.stringParam(Intent.FIELD) != null) {
            arguments.put("field", intent.stringParam(Intent.FIELD));
        }
        if (intent.stringParam(Intent.TIME_RANGE) != null) {
            arguments.put("time_range", intent.stringParam(Intent.TIME_RANGE));
        }
        arguments.put("limit", limit(intent, config.getKeywordLimit()));
        return Optional.of(arguments);
    }

    private Optional<String> resolvedPaperId(Intent intent, List<ToolResult> earlier) {
        Optional<String> looked = resultOf(earlier, GET_PAPER_DETAILS).flatMap(payloadReader::firstPaperId);
        return looked.isPresent() ? looked : Optional.ofNullable(intent.stringParam(Intent.PAPER_ID));
    }

    private static Optional<ToolResult> resultOf(List<ToolResult> earlier, String toolName) {
        return earlier.stream()
                .filter(result -> toolName.equals(result.toolName()) && !result.isFailed())
                .findFirst();
    }

    private static int limit(Intent intent, int fallback) {
        Integer requested = intent.intParam(Intent.LIMIT);
        return requested == null || requested <= 0 ? fallback : requested;
    }
}
