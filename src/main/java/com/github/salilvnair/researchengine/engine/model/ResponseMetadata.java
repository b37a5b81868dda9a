package com.github.salilvnair.researchengine.engine.model;

import java.util.List;

public record ResponseMetadata(
        IntentType intentType,
        double confidence,
        long processingTimeMs,
        boolean degraded,
        boolean error,
        String strategy,
        List<String> dataSources
) {
    public ResponseMetadata {
        dataSources = dataSources == null ? List.of() : List.copyOf(dataSources);
    }
}
