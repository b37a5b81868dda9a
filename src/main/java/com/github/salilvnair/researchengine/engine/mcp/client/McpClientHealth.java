package com.github.salilvnair.researchengine.engine.mcp.client;

import java.util.List;

public record McpClientHealth(
        ConnectionState state,
        boolean alive,
        int consecutiveConnectFailures,
        int consecutiveTimeouts,
        int pendingRequests,
        List<String> availableTools
) {}
