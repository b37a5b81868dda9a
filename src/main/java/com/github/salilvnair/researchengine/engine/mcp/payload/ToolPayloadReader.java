package com.github.salilvnair.researchengine.engine.mcp.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.researchengine.engine.model.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reads the data carried by a {@code tools/call} result. Servers put it either in
 * {@code structuredContent}, as JSON text inside {@code content[]}, or directly in the result.
 */
@Component
@RequiredArgsConstructor
public class ToolPayloadReader {

    private static final List<String> ID_FIELDS = List.of("id", "paper_id", "paperId", "author_id", "authorId");

    private final ObjectMapper mapper;

    public JsonNode data(ToolResult result) {
        if (result == null || result.isFailed() || result.payload() == null) {
            return mapper.missingNode();
        }
        JsonNode payload = result.payload();
        if (payload.hasNonNull("structuredContent")) {
            return payload.get("structuredContent");
        }
        JsonNode content = payload.path("content");
        if (content.isArray()) {
            for (JsonNode item : content) {
                JsonNode parsed = parseText(item.path("text").asText(null));
                if (parsed != null) {
                    return parsed;
                }
            }
            return mapper.missingNode();
        }
        return payload;
    }

    /**
     * Plain text items of a result whose content is not JSON.
     */
    public Optional<String> text(ToolResult result) {
        if (result == null || result.isFailed() || result.payload() == null) {
            return Optional.empty();
        }
        for (JsonNode item : result.payload().path("content")) {
            String text = item.path("text").asText("");
            if (!text.isBlank() && parseText(text) == null) {
                return Optional.of(text.trim());
            }
        }
        return Optional.empty();
    }

    public Optional<String> firstPaperId(ToolResult result) {
        return firstId(data(result), "paper", "papers");
    }

    public Optional<String> firstAuthorId(ToolResult result) {
        return firstId(data(result), "author", "authors");
    }

    private Optional<String> firstId(JsonNode data, String singular, String plural) {
        if (data.isMissingNode() || data.isNull()) {
            return Optional.empty();
        }
        Optional<String> nested = idOf(data.path(singular));
        if (nested.isPresent()) {
            return nested;
        }
        JsonNode list = data.isArray() ? data : data.path(plural);
        if (list.isArray() && !list.isEmpty()) {
            return idOf(list.get(0));
        }
        return idOf(data);
    }

    private Optional<String> idOf(JsonNode node) {
        if (!node.isObject()) {
            return Optional.empty();
        }
        for (String field : ID_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    private JsonNode parseText(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return null;
        }
        try {
            return mapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
