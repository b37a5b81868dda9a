package com.github.salilvnair.researchengine.engine.model;

import java.time.Instant;

public record Query(
        String text,
        String userId,
        String conversationId,
        Instant timestamp
) {}
