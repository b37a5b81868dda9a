package com.github.salilvnair.researchengine.dispatch;

import com.github.salilvnair.researchengine.engine.model.IntentType;

import java.util.List;

public record ToolPlan(
        IntentType intentType,
        List<ToolStage> stages
) {

    public ToolPlan {
        stages = List.copyOf(stages);
    }

    public static ToolPlan none(IntentType intentType) {
        return new ToolPlan(intentType, List.of());
    }

    public List<String> toolNames() {
        return stages.stream()
                .flatMap(stage -> stage.steps().stream())
                .map(ToolStep::toolName)
                .toList();
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }
}
