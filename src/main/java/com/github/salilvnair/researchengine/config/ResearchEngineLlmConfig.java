package com.github.salilvnair.researchengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "researchengine.llm")
@Getter
@Setter
public class ResearchEngineLlmConfig {

    private String baseUrl = "https://api.together.xyz/v1/chat/completions";
    private String apiKey;
    private String model = "Qwen/Qwen2.5-72B-Instruct-Turbo";
    private String systemPrompt = "You are a professional academic research assistant.";
    private int maxTokens = 2000;
    private double temperature = 0.7d;
    private long timeoutMs = 30000L;
    private long connectTimeoutMs = 5000L;

    private Intent intent = new Intent();

    @Getter
    @Setter
    public static class Intent {
        private int maxTokens = 500;
        private double temperature = 0.3d;
        private long timeoutMs = 15000L;
    }
}
