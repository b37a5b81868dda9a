package com.github.salilvnair.researchengine.engine.exception;

public enum ResearchEngineErrorCode {

    // =========================
    // Protocol client errors
    // =========================
    TRANSPORT_ERROR(
            "Data service transport failed",
            true
    ),

    PROTOCOL_TIMEOUT(
            "Data service did not respond in time",
            true
    ),

    PROTOCOL_VIOLATION(
            "Data service sent a malformed message",
            false
    ),

    MCP_STARTUP_FAILED(
            "Data service subprocess could not be started",
            true
    ),

    MCP_CLIENT_CLOSED(
            "Data service client is closed",
            false
    ),

    // =========================
    // Tool errors
    // =========================
    TOOL_ERROR(
            "Data service tool returned an error",
            false
    ),

    DEPENDENCY_UNRESOLVED(
            "Tool input could not be resolved from earlier results",
            false
    ),

    // =========================
    // Intent errors
    // =========================
    CLASSIFICATION_AMBIGUOUS(
            "Query intent could not be classified with enough confidence",
            true
    ),

    // =========================
    // LLM related errors
    // =========================
    GENERATION_FAILURE(
            "Language model call failed",
            true
    ),

    LLM_TIMEOUT(
            "Language model call timed out",
            true
    ),

    // =========================
    // Request errors
    // =========================
    INVALID_REQUEST(
            "Request is missing required fields",
            false
    ),

    // =========================
    // Fallback
    // =========================
    QUERY_FAILED(
            "Research query failed",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ResearchEngineErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
