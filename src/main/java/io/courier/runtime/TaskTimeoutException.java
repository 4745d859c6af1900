package io.courier.runtime;

import java.time.Duration;

public final class TaskTimeoutException extends Exception {
    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " timed out after " + timeout.toSeconds() + "s");
    }
}
