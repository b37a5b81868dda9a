package com.github.salilvnair.researchengine.engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ConversationTurn(
        TurnRole role,
        String content,
        IntentType intentType,
        Map<String, Object> parameters,
        Instant createdAt
) {
    public ConversationTurn {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static ConversationTurn user(String content, Instant createdAt) {
        return new ConversationTurn(TurnRole.USER, content, null, Map.of(), createdAt);
    }

    public static ConversationTurn assistant(String content, Intent intent, Instant createdAt) {
        return new ConversationTurn(TurnRole.ASSISTANT, content, intent.type(), intent.parameters(), createdAt);
    }
}
