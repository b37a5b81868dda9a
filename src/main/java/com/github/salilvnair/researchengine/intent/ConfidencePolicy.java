package com.github.salilvnair.researchengine.intent;

public interface ConfidencePolicy {

    /**
     * Confidence for a candidate. Must not decrease when the match strength increases.
     */
    double score(MatchStrength strength, boolean requiredSlotMissing, boolean coreferenced);

    /**
     * Confidence for a model produced classification, after the same slot adjustments.
     */
    double scoreModelSignal(double modelConfidence, boolean requiredSlotMissing, boolean coreferenced);

    double minimumConfidence();

    default boolean accepts(double confidence) {
        return confidence >= minimumConfidence();
    }
}
