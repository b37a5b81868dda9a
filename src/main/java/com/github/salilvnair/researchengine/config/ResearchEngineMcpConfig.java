package com.github.salilvnair.researchengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "researchengine.mcp")
@Getter
@Setter
public class ResearchEngineMcpConfig {

    private String command = "python";
    private List<String> args = new ArrayList<>(List.of("server.py"));
    private String workingDirectory;
    private Map<String, String> environment = new LinkedHashMap<>();

    /**
     * Upper bound for subprocess spawn plus the initialize handshake.
     */
    private long connectTimeoutMs = 30000L;
    private long callTimeoutMs = 30000L;
    private int maxRetries = 3;
    private long retryDelayMs = 1000L;

    /**
     * Consecutive call timeouts that move a Ready connection to Degraded.
     */
    private int timeoutThreshold = 3;
    private long shutdownGraceMs = 2000L;
    private boolean eagerStart = false;

    private String protocolVersion = "2024-11-05";
    private String clientName = "research-engine";
    private String clientVersion = "1.0.0";

    private DebugLog debugLog = new DebugLog();

    @Getter
    @Setter
    public static class DebugLog {
        private boolean enabled = false;
        /**
         * File the subprocess stderr is appended to. Without it stderr goes to the SLF4J logger.
         */
        private String path;
    }
}
