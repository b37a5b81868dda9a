package com.github.salilvnair.researchengine.engine.mcp.client;

public interface McpTransportListener {

    /**
     * One line read from the server's stdout, without the line terminator.
     */
    void onMessage(String line);

    /**
     * The server side went away. Called at most once per transport.
     */
    void onClosed(Throwable cause);
}
