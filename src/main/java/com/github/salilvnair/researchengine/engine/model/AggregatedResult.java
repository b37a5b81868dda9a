package com.github.salilvnair.researchengine.engine.model;

import java.util.List;

/**
 * Tool results of one intent, in invocation issue order.
 */
public record AggregatedResult(
        Intent intent,
        List<ToolExchange> exchanges
) {

    public AggregatedResult {
        exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
    }

    public static AggregatedResult empty(Intent intent) {
        return new AggregatedResult(intent, List.of());
    }

    public List<ToolResult> results() {
        return exchanges.stream().map(ToolExchange::result).toList();
    }

    public List<ToolResult> successfulResults() {
        return results().stream().filter(result -> !result.isFailed()).toList();
    }

    public List<ToolResult> failedResults() {
        return results().stream().filter(ToolResult::isFailed).toList();
    }

    public boolean isEmpty() {
        return exchanges.isEmpty();
    }

    public boolean hasFailures() {
        return exchanges.stream().anyMatch(exchange -> exchange.result().isFailed());
    }

    public boolean hasSuccess() {
        return exchanges.stream().anyMatch(exchange -> !exchange.result().isFailed());
    }
}
