package com.github.salilvnair.researchengine.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolInvocation(
        String toolName,
        Map<String, Object> arguments,
        long correlationId
) {
    public ToolInvocation {
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
