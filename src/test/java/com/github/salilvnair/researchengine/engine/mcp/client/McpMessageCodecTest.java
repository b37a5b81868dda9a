package com.github.salilvnair.researchengine.engine.mcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.model.ToolInvocation;
import com.github.salilvnair.researchengine.engine.model.ToolResult;
import com.github.salilvnair.researchengine.engine.model.ToolStatus;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalLong;

import static com.github.salilvnair.researchengine.support.TestConstants.KEYWORD_DEEP_LEARNING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpMessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final McpMessageCodec codec = new McpMessageCodec(mapper);
    private final ToolInvocation invocation = new ToolInvocation("search_papers", Map.of("query", KEYWORD_DEEP_LEARNING), 7L);

    @Test
    void encodeRequestWritesSingleLineJsonRpcFrame() throws Exception {
        String frame = codec.encodeRequest(7L, McpMessageCodec.METHOD_TOOLS_CALL,
                codec.toolCallParams("search_papers", Map.of("query", KEYWORD_DEEP_LEARNING, "limit", 6)));

        JsonNode node = mapper.readTree(frame);
        assertFalse(frame.contains("\n"));
        assertEquals("2.0", node.path("jsonrpc").asText());
        assertEquals(7L, node.path("id").asLong());
        assertEquals("tools/call", node.path("method").asText());
        assertEquals("search_papers", node.path("params").path("name").asText());
        assertEquals(6, node.path("params").path("arguments").path("limit").asInt());
    }

    @Test
    void notificationCarriesNoId() throws Exception {
        JsonNode node = mapper.readTree(codec.encodeNotification(McpMessageCodec.METHOD_INITIALIZED, null));

        assertFalse(node.has("id"));
        assertEquals("notifications/initialized", node.path("method").asText());
    }

    @Test
    void decodeSkipsNonProtocolLines() {
        assertTrue(codec.decode("Starting academic server on stdio").isEmpty());
        assertTrue(codec.decode("{not json").isEmpty());
        assertTrue(codec.decode("   ").isEmpty());
        assertTrue(codec.decode("{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":{}}").isPresent());
    }

    @Test
    void responseIdAcceptsNumericStrings() throws Exception {
        assertEquals(OptionalLong.of(12L), codec.responseId(mapper.readTree("{\"id\":\"12\",\"result\":{}}")));
        assertTrue(codec.responseId(mapper.readTree("{\"id\":\"abc\",\"result\":{}}")).isEmpty());
        assertFalse(codec.isResponse(mapper.readTree("{\"method\":\"notifications/message\"}")));
    }

    @Test
    void toToolResultMapsErrorsAndSuccess() throws Exception {
        ToolResult ok = codec.toToolResult(invocation,
                mapper.readTree("{\"id\":7,\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"{}\"}]}}"));
        ToolResult toolError = codec.toToolResult(invocation,
                mapper.readTree("{\"id\":7,\"result\":{\"isError\":true,\"content\":[{\"type\":\"text\",\"text\":\"rate limited\"}]}}"));
        ToolResult rpcError = codec.toToolResult(invocation,
                mapper.readTree("{\"id\":7,\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}"));

        assertEquals(ToolStatus.OK, ok.status());
        assertEquals(7L, ok.correlationId());
        assertEquals(ResearchEngineErrorCode.TOOL_ERROR, toolError.error().code());
        assertEquals("rate limited", toolError.error().detail());
        assertEquals("Method not found (code -32601)", rpcError.error().detail());
    }
}
