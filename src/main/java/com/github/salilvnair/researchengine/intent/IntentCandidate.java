package com.github.salilvnair.researchengine.intent;

import com.github.salilvnair.researchengine.engine.model.IntentType;

public record IntentCandidate(
        IntentType type,
        MatchStrength strength,
        String matchedRule
) {}
