package com.github.salilvnair.researchengine.engine.model;

import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;

/**
 * Failure detail of a tool call. The detail is internal text and is only ever logged.
 */
public record ToolError(
        ResearchEngineErrorCode code,
        String detail
) {}
