package com.github.salilvnair.researchengine.engine.mcp.client;

@FunctionalInterface
public interface McpTransportFactory {
    McpTransport create();
}
