package com.github.salilvnair.researchengine.intent;

import com.github.salilvnair.researchengine.engine.model.IntentType;

import java.util.Map;

public record ModelIntentSignal(
        IntentType type,
        double confidence,
        Map<String, Object> parameters
) {}
