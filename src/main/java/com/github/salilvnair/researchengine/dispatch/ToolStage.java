package com.github.salilvnair.researchengine.dispatch;

import java.util.List;

/**
 * Steps that run concurrently. A stage starts only after the previous one has fully completed.
 */
public record ToolStage(List<ToolStep> steps) {

    public ToolStage {
        steps = List.copyOf(steps);
    }

    public static ToolStage of(ToolStep... steps) {
        return new ToolStage(List.of(steps));
    }
}
