package com.github.salilvnair.researchengine.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.model.ToolExchange;
import com.github.salilvnair.researchengine.engine.model.ToolInvocation;
import com.github.salilvnair.researchengine.engine.model.ToolResult;

import java.util.Map;

public final class IntegrationFixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IntegrationFixtures() {
    }

    public static ToolExchange ok(long id, String toolName, String json) {
        return new ToolExchange(new ToolInvocation(toolName, Map.of(), id), ToolResult.ok(id, toolName, content(json)));
    }

    public static ToolExchange failed(long id, String toolName, String detail) {
        return new ToolExchange(new ToolInvocation(toolName, Map.of(), id),
                ToolResult.error(id, toolName, ResearchEngineErrorCode.TRANSPORT_ERROR, detail));
    }

    public static JsonNode content(String text) {
        return MAPPER.createObjectNode().set("content",
                MAPPER.createArrayNode().add(MAPPER.createObjectNode().put("type", "text").put("text", text)));
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
