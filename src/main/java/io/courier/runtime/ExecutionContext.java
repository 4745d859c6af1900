package io.courier.runtime;

import io.courier.agent.Subagent;
import io.courier.model.Task;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-task handle given to a strategy: progress reporting, the cooperative
 * cancellation check and bookkeeping for subagents the task owns.
 */
public final class ExecutionContext {
    private final Task task;
    private final TaskScheduler scheduler;
    private final Set<String> liveSubagents = ConcurrentHashMap.newKeySet();

    public ExecutionContext(Task task, TaskScheduler scheduler) {
        this.task = task;
        this.scheduler = scheduler;
    }

    public Task task() {
        return task;
    }

    public String taskId() {
        return task.id();
    }

    public String description() {
        return task.description();
    }

    /**
     * Records progress, then stops the task if a cancel was requested. On
     * cancel the task is moved to cancelled before the exception is thrown.
     */
    public void checkpoint(double progress, String message) {
        scheduler.reportProgress(task.id(), progress, message);
        throwIfCancelled();
    }

    public void throwIfCancelled() {
        if (scheduler.isCancellationRequested(task.id())) {
            scheduler.markCancelled(task.id(), "cancel_requested");
            throw new TaskCancelledException(task.id());
        }
    }

    void trackSubagent(Subagent subagent) {
        liveSubagents.add(subagent.id());
    }

    void releaseSubagent(Subagent subagent) {
        liveSubagents.remove(subagent.id());
    }

    public int liveSubagents() {
        return liveSubagents.size();
    }
}
