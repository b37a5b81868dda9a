package com.github.salilvnair.researchengine.llm.core;

import com.github.salilvnair.researchengine.config.ResearchEngineLlmConfig;

import java.time.Duration;

public record LlmGenerationOptions(
        int maxTokens,
        double temperature,
        Duration timeout
) {

    public static LlmGenerationOptions forResponse(ResearchEngineLlmConfig config) {
        return new LlmGenerationOptions(config.getMaxTokens(), config.getTemperature(),
                Duration.ofMillis(config.getTimeoutMs()));
    }

    public static LlmGenerationOptions forIntent(ResearchEngineLlmConfig config) {
        ResearchEngineLlmConfig.Intent intent = config.getIntent();
        return new LlmGenerationOptions(intent.getMaxTokens(), intent.getTemperature(),
                Duration.ofMillis(intent.getTimeoutMs()));
    }
}
