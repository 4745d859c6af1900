package io.courier.runtime;

import io.courier.model.TaskStatus;

/**
 * Result of one executor cycle. {@code processed} is false when no task was
 * available or the claim went to another executor.
 */
public record ExecutionOutcome(boolean processed, String taskId, TaskStatus status, String message) {
    public static ExecutionOutcome idle() {
        return new ExecutionOutcome(false, null, null, "No pending tasks");
    }

    public static ExecutionOutcome claimLost(String taskId) {
        return new ExecutionOutcome(false, taskId, null, "Task already claimed by another executor");
    }

    public boolean claimLost() {
        return !processed && taskId != null;
    }
}
