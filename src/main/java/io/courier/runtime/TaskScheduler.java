package io.courier.runtime;

import io.courier.model.Task;
import io.courier.model.TaskEvent;
import io.courier.model.TaskMode;
import io.courier.model.TaskPriority;
import io.courier.model.TaskStatus;
import io.courier.observability.AuditLogger;
import io.courier.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Priority queue over the task table. The store is the source of truth; this
 * class adds the blocking wait for new work and the audit trail.
 */
public final class TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);
    private static final String ACTOR = "scheduler";

    private final TaskStore store;
    private final AuditLogger auditLogger;
    private final Object signal = new Object();
    private long version;

    public TaskScheduler(TaskStore store, AuditLogger auditLogger) {
        this.store = store;
        this.auditLogger = auditLogger;
    }

    public Task create(String description, TaskMode mode, TaskPriority priority, String createdBy,
                       Map<String, Object> metadata) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("task description cannot be empty");
        }
        Task task = store.insertTask(new TaskStore.NewTask(
                description.strip(),
                mode == null ? TaskMode.WORKER : mode,
                priority == null ? TaskPriority.NORMAL : priority,
                createdBy == null || createdBy.isBlank() ? "unknown" : createdBy,
                metadata == null ? Map.of() : metadata,
                nowMs()
        ));
        log.info("Created task {} mode={} priority={}", task.id(), task.mode().wireName(), task.priority().wireName());
        audit("task.create", task.id(), "ok", Map.of(
                "mode", task.mode().wireName(),
                "priority", task.priority().wireName(),
                "created_by", task.createdBy()
        ));
        synchronized (signal) {
            version++;
            signal.notifyAll();
        }
        return task;
    }

    /**
     * Returns the next pending task without claiming it, waiting up to
     * {@code timeout} for one to be created.
     */
    public Optional<Task> dequeue(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        while (true) {
            long seen;
            synchronized (signal) {
                seen = version;
            }
            Optional<Task> next = store.nextPending();
            if (next.isPresent()) {
                return next;
            }
            synchronized (signal) {
                while (version == seen) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0L) {
                        return Optional.empty();
                    }
                    TimeUnit.NANOSECONDS.timedWait(signal, remaining);
                }
            }
        }
    }

    public boolean claim(String taskId) {
        boolean claimed = store.tryClaim(taskId, nowMs());
        if (!claimed) {
            log.debug("Claim lost for task {}", taskId);
        }
        return claimed;
    }

    public boolean reportProgress(String taskId, double progress, String message) {
        if (Double.isNaN(progress)) {
            throw new IllegalArgumentException("progress cannot be NaN");
        }
        double clamped = Math.max(0.0d, Math.min(1.0d, progress));
        return store.updateProgress(taskId, clamped, message, nowMs());
    }

    public boolean complete(String taskId, String result) {
        boolean done = store.tryComplete(taskId, result, nowMs());
        if (done) {
            audit("task.complete", taskId, "ok", Map.of());
        }
        return done;
    }

    public boolean fail(String taskId, String error) {
        boolean done = store.tryFail(taskId, error, nowMs());
        if (done) {
            audit("task.fail", taskId, "failed", Map.of("error", error == null ? "" : error));
        }
        return done;
    }

    /**
     * Pending tasks are cancelled immediately; running tasks are flagged and
     * stop at their next checkpoint. Terminal or unknown tasks return false.
     */
    public boolean cancel(String taskId) {
        return cancelDetailed(taskId).accepted();
    }

    public TaskStore.CancelResult cancelDetailed(String taskId) {
        TaskStore.CancelResult result = store.cancelTask(taskId, nowMs());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("outcome", result.outcome().name().toLowerCase());
        if (result.previousStatus() != null) {
            details.put("previous_status", result.previousStatus().wireName());
        }
        audit("task.cancel", taskId, result.accepted() ? "ok" : "rejected", details);
        if (result.accepted()) {
            log.info("Cancel {} for task {}", result.outcome().name().toLowerCase(), taskId);
        }
        return result;
    }

    public boolean markCancelled(String taskId, String reason) {
        boolean done = store.tryMarkCancelled(taskId, reason == null ? "cancel_requested" : reason, nowMs());
        if (done) {
            audit("task.cancelled", taskId, "ok", Map.of("reason", reason == null ? "cancel_requested" : reason));
        }
        return done;
    }

    public boolean isCancellationRequested(String taskId) {
        return store.isCancellationRequested(taskId);
    }

    public List<TaskEvent> events(String taskId) {
        return store.listEvents(taskId);
    }

    public Map<TaskStatus, Integer> stats() {
        return store.countByStatus();
    }

    public Optional<Task> get(String taskId) {
        return store.getTask(taskId);
    }

    public List<Task> list(TaskStatus status, int limit) {
        return store.listTasks(status, limit);
    }

    /**
     * Fails tasks a previous process left running. Call before any executor
     * over this store starts.
     */
    public List<String> recover() {
        List<String> recovered = store.failInterruptedRunning("interrupted by restart", nowMs());
        if (!recovered.isEmpty()) {
            log.warn("Marked {} interrupted task(s) as failed: {}", recovered.size(), recovered);
            for (String taskId : recovered) {
                audit("task.recover", taskId, "failed", Map.of());
            }
        }
        return recovered;
    }

    private void audit(String action, String taskId, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.task(action, ACTOR, taskId, result, details));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit row for {} {}", action, taskId, e);
        }
    }

    private static long nowMs() {
        return Instant.now().toEpochMilli();
    }
}
