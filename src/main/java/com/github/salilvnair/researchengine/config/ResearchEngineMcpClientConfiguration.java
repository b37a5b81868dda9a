package com.github.salilvnair.researchengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.researchengine.engine.mcp.client.McpProtocolClient;
import com.github.salilvnair.researchengine.engine.mcp.client.McpTransportFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ScheduledExecutorService;

@Slf4j
@Configuration
public class ResearchEngineMcpClientConfiguration {

    @Bean(destroyMethod = "close")
    public McpProtocolClient mcpProtocolClient(McpTransportFactory transportFactory,
                                               ResearchEngineMcpConfig config,
                                               ObjectMapper objectMapper,
                                               @Qualifier(ResearchEngineAsyncConfiguration.ENGINE_EXECUTOR) ThreadPoolTaskExecutor executor,
                                               @Qualifier(ResearchEngineAsyncConfiguration.ENGINE_SCHEDULER) ScheduledExecutorService scheduler) {
        McpProtocolClient client = new McpProtocolClient(transportFactory, config, objectMapper, executor, scheduler);
        if (config.isEagerStart()) {
            client.start().whenComplete((ignored, failure) -> {
                if (failure != null) {
                    log.error("Eager MCP start failed: {}", failure.getMessage());
                }
            });
        }
        return client;
    }
}
