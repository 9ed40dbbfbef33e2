package com.signalfusion.orchestrator.ai;

import java.util.Objects;

/**
 * What a language-model call is for. Routing reads only this record, never runtime load.
 *
 * @param taskType   short task name, e.g. {@code synthesis_reasoning}
 * @param hint       optional free text that refines the complexity guess
 * @param forcedTier tier to use regardless of complexity, or null
 */
public record TaskDescriptor(String taskType, String hint, ModelTier forcedTier) {

    public TaskDescriptor {
        Objects.requireNonNull(taskType, "taskType");
    }

    public static TaskDescriptor of(String taskType) {
        return new TaskDescriptor(taskType, null, null);
    }

    public static TaskDescriptor of(String taskType, String hint) {
        return new TaskDescriptor(taskType, hint, null);
    }

    public static TaskDescriptor forced(String taskType, ModelTier tier) {
        return new TaskDescriptor(taskType, null, tier);
    }

    public TaskComplexity complexity() {
        return TaskComplexity.infer(taskType, hint);
    }
}
