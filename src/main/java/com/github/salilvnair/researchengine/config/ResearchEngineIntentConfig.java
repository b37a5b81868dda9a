package com.github.salilvnair.researchengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "researchengine.intent")
@Getter
@Setter
public class ResearchEngineIntentConfig {

    private double minConfidence = 0.5d;
    private double exactMatchConfidence = 0.95d;
    private double strongMatchConfidence = 0.85d;
    private double weakMatchConfidence = 0.6d;
    private double missingSlotPenalty = 0.4d;
    private double coreferencePenalty = 0.05d;

    /**
     * Prior turns considered for pronoun resolution.
     */
    private int historyWindow = 6;
    private boolean llmAssistEnabled = false;
}
