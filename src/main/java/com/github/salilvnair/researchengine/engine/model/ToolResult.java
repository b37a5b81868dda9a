package com.github.salilvnair.researchengine.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;

public record ToolResult(
        long correlationId,
        String toolName,
        ToolStatus status,
        JsonNode payload,
        ToolError error
) {

    public static ToolResult ok(long correlationId, String toolName, JsonNode payload) {
        return new ToolResult(correlationId, toolName, ToolStatus.OK, payload, null);
    }

    public static ToolResult error(long correlationId, String toolName, ResearchEngineErrorCode code, String detail) {
        return new ToolResult(correlationId, toolName, ToolStatus.ERROR, null, new ToolError(code, detail));
    }

    public static ToolResult timeout(long correlationId, String toolName, String detail) {
        return new ToolResult(correlationId, toolName, ToolStatus.TIMEOUT, null,
                new ToolError(ResearchEngineErrorCode.PROTOCOL_TIMEOUT, detail));
    }

    public boolean isFailed() {
        return status != ToolStatus.OK;
    }
}
