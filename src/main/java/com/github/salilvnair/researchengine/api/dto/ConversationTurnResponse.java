package com.github.salilvnair.researchengine.api.dto;

import java.time.Instant;
import java.util.Map;

public record ConversationTurnResponse(
        String role,
        String content,
        String intentType,
        Map<String, Object> parameters,
        Instant createdAt
) {}
