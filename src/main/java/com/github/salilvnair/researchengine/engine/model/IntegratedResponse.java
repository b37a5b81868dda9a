package com.github.salilvnair.researchengine.engine.model;

import java.util.List;

public record IntegratedResponse(
        String message,
        ResponseMetadata metadata,
        List<String> suggestions
) {
    public IntegratedResponse {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
