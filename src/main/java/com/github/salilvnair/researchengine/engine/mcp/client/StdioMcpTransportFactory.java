package com.github.salilvnair.researchengine.engine.mcp.client;

import com.github.salilvnair.researchengine.config.ResearchEngineMcpConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StdioMcpTransportFactory implements McpTransportFactory {

    private final ResearchEngineMcpConfig config;

    @Override
    public McpTransport create() {
        return new StdioMcpTransport(config);
    }
}
