package com.github.salilvnair.researchengine.intent;

import com.github.salilvnair.researchengine.config.ResearchEngineIntentConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ThresholdConfidencePolicy implements ConfidencePolicy {

    private final ResearchEngineIntentConfig config;

    @Override
    public double score(MatchStrength strength, boolean requiredSlotMissing, boolean coreferenced) {
        double base = switch (strength) {
            case EXACT -> config.getExactMatchConfidence();
            case STRONG -> config.getStrongMatchConfidence();
            case WEAK -> config.getWeakMatchConfidence();
        };
        return adjust(base, requiredSlotMissing, coreferenced);
    }

    @Override
    public double scoreModelSignal(double modelConfidence, boolean requiredSlotMissing, boolean coreferenced) {
        // a model answer never outranks a strong pattern match
        double base = Math.min(clamp(modelConfidence), config.getStrongMatchConfidence());
        return adjust(base, requiredSlotMissing, coreferenced);
    }

    @Override
    public double minimumConfidence() {
        return config.getMinConfidence();
    }

    private double adjust(double base, boolean requiredSlotMissing, boolean coreferenced) {
        double value = base;
        if (requiredSlotMissing) {
            value -= config.getMissingSlotPenalty();
        }
        if (coreferenced) {
            value -= config.getCoreferencePenalty();
        }
        return clamp(value);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, value));
    }
}
