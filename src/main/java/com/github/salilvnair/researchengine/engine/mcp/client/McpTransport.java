package com.github.salilvnair.researchengine.engine.mcp.client;

import java.io.IOException;

public interface McpTransport extends AutoCloseable {

    void start(McpTransportListener listener) throws IOException;

    /**
     * Writes one frame. Implementations append the line terminator and are safe for concurrent callers.
     */
    void send(String frame) throws IOException;

    boolean isAlive();

    @Override
    void close();
}
