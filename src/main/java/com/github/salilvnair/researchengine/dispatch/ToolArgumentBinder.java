package com.github.salilvnair.researchengine.dispatch;

import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the arguments of one tool call. Empty means a required input is unavailable.
 */
@FunctionalInterface
public interface ToolArgumentBinder {
    Optional<Map<String, Object>> bind(Intent intent, List<ToolResult> earlierResults);
}
