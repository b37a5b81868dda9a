package com.github.salilvnair.researchengine.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SlotFill(
        Map<String, Object> parameters,
        boolean requiredSlotMissing,
        boolean coreferenced
) {
    public SlotFill {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters == null ? Map.of() : parameters));
    }
}
