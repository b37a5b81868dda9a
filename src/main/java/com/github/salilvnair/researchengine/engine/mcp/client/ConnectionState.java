package com.github.salilvnair.researchengine.engine.mcp.client;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    READY,
    DEGRADED,
    CLOSED
}
