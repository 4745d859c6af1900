package io.courier.runtime;

/**
 * Unwinds a strategy after the task has already been moved to cancelled.
 */
public final class TaskCancelledException extends RuntimeException {
    private final String taskId;

    public TaskCancelledException(String taskId) {
        super("Task cancelled: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
