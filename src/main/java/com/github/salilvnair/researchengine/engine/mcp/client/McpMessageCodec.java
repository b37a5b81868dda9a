package com.github.salilvnair.researchengine.engine.mcp.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import com.github.salilvnair.researchengine.engine.model.ToolInvocation;
import com.github.salilvnair.researchengine.engine.model.ToolResult;
import lombok.RequiredArgsConstructor;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * JSON-RPC 2.0 framing for the newline delimited stdio channel.
 */
@RequiredArgsConstructor
public class McpMessageCodec {

    public static final String METHOD_INITIALIZE = "initialize";
    public static final String METHOD_INITIALIZED = "notifications/initialized";
    public static final String METHOD_TOOLS_LIST = "tools/list";
    public static final String METHOD_TOOLS_CALL = "tools/call";

    private static final String JSONRPC_VERSION = "2.0";

    private final ObjectMapper mapper;

    public String encodeRequest(long id, String method, JsonNode params) {
        ObjectNode message = mapper.createObjectNode();
        message.put("jsonrpc", JSONRPC_VERSION);
        message.put("id", id);
        message.put("method", method);
        message.set("params", params == null ? mapper.createObjectNode() : params);
        return write(message);
    }

    public String encodeNotification(String method, JsonNode params) {
        ObjectNode message = mapper.createObjectNode();
        message.put("jsonrpc", JSONRPC_VERSION);
        message.put("method", method);
        if (params != null) {
            message.set("params", params);
        }
        return write(message);
    }

    public ObjectNode initializeParams(String protocolVersion, String clientName, String clientVersion) {
        ObjectNode params = mapper.createObjectNode();
        params.put("protocolVersion", protocolVersion);
        params.set("capabilities", mapper.createObjectNode());
        ObjectNode clientInfo = params.putObject("clientInfo");
        clientInfo.put("name", clientName);
        clientInfo.put("version", clientVersion);
        return params;
    }

    public ObjectNode toolCallParams(String toolName, Map<String, Object> arguments) {
        ObjectNode params = mapper.createObjectNode();
        params.put("name", toolName);
        params.set("arguments", mapper.valueToTree(arguments == null ? Map.of() : arguments));
        return params;
    }

    /**
     * Parses one stdout line. Blank lines, server log output and non-object JSON yield empty.
     */
    public Optional<JsonNode> decode(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(trimmed);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public OptionalLong responseId(JsonNode message) {
        JsonNode id = message.get("id");
        if (id == null || id.isNull()) {
            return OptionalLong.empty();
        }
        if (id.isIntegralNumber()) {
            return OptionalLong.of(id.asLong());
        }
        String text = id.asText("");
        if (text.matches("\\d+")) {
            return OptionalLong.of(Long.parseLong(text));
        }
        return OptionalLong.empty();
    }

    public boolean isResponse(JsonNode message) {
        return message.has("id") && (message.has("result") || message.has("error"));
    }

    public String errorMessage(JsonNode response) {
        JsonNode error = response.path("error");
        String message = error.path("message").asText("");
        int code = error.path("code").asInt(0);
        return message.isBlank() ? "error code " + code : message + " (code " + code + ")";
    }

    /**
     * Maps a raw {@code tools/call} response to a terminal tool result.
     */
    public ToolResult toToolResult(ToolInvocation invocation, JsonNode response) {
        if (response.hasNonNull("error")) {
            return ToolResult.error(invocation.correlationId(), invocation.toolName(),
                    ResearchEngineErrorCode.TOOL_ERROR, errorMessage(response));
        }
        JsonNode result = response.path("result");
        if (result.path("isError").asBoolean(false)) {
            return ToolResult.error(invocation.correlationId(), invocation.toolName(),
                    ResearchEngineErrorCode.TOOL_ERROR, firstText(result));
        }
        return ToolResult.ok(invocation.correlationId(), invocation.toolName(), result);
    }

    private String firstText(JsonNode result) {
        for (JsonNode item : result.path("content")) {
            if (item.hasNonNull("text")) {
                return item.get("text").asText();
            }
        }
        return "tool reported an error";
    }

    private String write(ObjectNode message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ResearchEngineException(ResearchEngineErrorCode.PROTOCOL_VIOLATION,
                    "Failed to encode JSON-RPC message", e);
        }
    }
}
