package com.github.salilvnair.researchengine.api.dto;

public record ErrorResponse(
        String errorCode,
        String message,
        boolean recoverable
) {}
