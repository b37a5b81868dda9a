package com.github.salilvnair.researchengine.dispatch;

public record ToolStep(
        String toolName,
        ToolArgumentBinder binder
) {}
