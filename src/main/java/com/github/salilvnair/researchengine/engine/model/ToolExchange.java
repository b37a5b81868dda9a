package com.github.salilvnair.researchengine.engine.model;

public record ToolExchange(
        ToolInvocation invocation,
        ToolResult result
) {}
