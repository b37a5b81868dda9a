package com.github.salilvnair.researchengine.engine.mcp.client;

import com.github.salilvnair.researchengine.engine.model.ToolInvocation;
import com.github.salilvnair.researchengine.engine.model.ToolResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool call capability of the data service. The returned future always completes normally
 * with exactly one terminal {@link ToolResult}.
 */
public interface McpToolClient {

    long nextCorrelationId();

    Duration defaultCallTimeout();

    CompletableFuture<ToolResult> request(ToolInvocation invocation, Duration timeout);

    default CompletableFuture<ToolResult> request(String toolName, Map<String, Object> arguments, Duration timeout) {
        return request(new ToolInvocation(toolName, arguments, nextCorrelationId()), timeout);
    }
}
