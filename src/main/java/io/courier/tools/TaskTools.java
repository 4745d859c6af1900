package io.courier.tools;

import io.courier.model.Task;
import io.courier.model.TaskEvent;
import io.courier.model.TaskMode;
import io.courier.model.TaskPriority;
import io.courier.model.TaskStatus;
import io.courier.runtime.TaskScheduler;
import io.courier.storage.TaskStore;
import io.courier.util.Jsons;
import io.courier.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntSupplier;

/**
 * Task operations exposed to the assistant as tools. Every call returns JSON
 * text with a {@code success} flag; bad input and unknown ids come back as
 * {@code success:false} with an {@code error} instead of an exception.
 */
public final class TaskTools {
    private static final Logger log = LoggerFactory.getLogger(TaskTools.class);
    private static final int DEFAULT_LIST_LIMIT = 10;
    private static final int SPAWN_NOTICE_DESCRIPTION_CHARS = 60;

    private final TaskScheduler scheduler;
    private final IntSupplier recentEventLimit;

    public TaskTools(TaskScheduler scheduler, IntSupplier recentEventLimit) {
        this.scheduler = scheduler;
        this.recentEventLimit = recentEventLimit;
    }

    public String spawnTask(ToolContext context, String description, String mode, String priority) {
        TaskMode taskMode;
        try {
            taskMode = TaskMode.fromString(mode);
        } catch (IllegalArgumentException e) {
            return error("Invalid mode '" + mode + "'. Use: worker, subagent, or background");
        }
        TaskPriority taskPriority;
        try {
            taskPriority = TaskPriority.fromString(priority);
        } catch (IllegalArgumentException e) {
            return error("Invalid priority '" + priority + "'. Use: low, normal, high, or urgent");
        }
        if (description == null || description.isBlank()) {
            return error("Task description cannot be empty");
        }

        ToolContext ctx = context == null ? ToolContext.anonymous() : context;
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (ctx.conversationId() != null) {
            metadata.put("conversation_id", ctx.conversationId());
        }
        Task task = scheduler.create(description, taskMode, taskPriority, ctx.actor(), metadata);
        sendSpawnNotice(ctx, task);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("task_id", task.id());
        out.put("description", task.description());
        out.put("mode", task.mode().wireName());
        out.put("priority", task.priority().wireName());
        out.put("status", task.status().wireName());
        out.put("message", "Task created and queued. Use getTaskStatus('" + task.id() + "') to check progress.");
        return Jsons.toJson(out);
    }

    public String listTasks(String status, Integer limit) {
        TaskStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = TaskStatus.fromString(status);
            } catch (IllegalArgumentException e) {
                return error("Invalid status '" + status + "'. Use: pending, running, completed, failed, cancelled");
            }
        }
        int safeLimit = limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : limit;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Task task : scheduler.list(filter, safeLimit)) {
            rows.add(TaskViews.summary(task));
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        for (Map.Entry<TaskStatus, Integer> entry : scheduler.stats().entrySet()) {
            stats.put(entry.getKey().wireName(), entry.getValue());
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("tasks", rows);
        out.put("stats", stats);
        out.put("count", rows.size());
        return Jsons.toJson(out);
    }

    public String getTaskStatus(String taskId) {
        Optional<Task> task = lookup(taskId);
        if (task.isEmpty()) {
            return error("Task not found: " + taskId);
        }
        List<TaskEvent> events = scheduler.events(taskId);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("task", TaskViews.detail(task.get()));
        out.put("events", recentEvents(events));
        out.put("event_count", events.size());
        return Jsons.toJson(out);
    }

    public String cancelTask(String taskId) {
        Optional<Task> task = lookup(taskId);
        if (task.isEmpty()) {
            return error("Task not found: " + taskId);
        }
        if (task.get().status().terminal()) {
            return error("Task already finished with status: " + task.get().status().wireName());
        }
        TaskStore.CancelResult result = scheduler.cancelDetailed(taskId);
        if (!result.accepted()) {
            if (result.previousStatus() != null && result.previousStatus().terminal()) {
                return error("Task already finished with status: " + result.previousStatus().wireName());
            }
            return error("Failed to cancel task");
        }
        String message = result.outcome() == TaskStore.CancelOutcome.CANCELLED
                ? "Task cancelled immediately (was pending)"
                : "Cancellation requested (task is running, may take a moment)";

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("task_id", taskId);
        out.put("message", message);
        scheduler.get(taskId).ifPresent(current -> {
            out.put("task", TaskViews.detail(current));
            out.put("events", recentEvents(scheduler.events(taskId)));
        });
        return Jsons.toJson(out);
    }

    private Optional<Task> lookup(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return Optional.empty();
        }
        return scheduler.get(taskId);
    }

    private List<Map<String, Object>> recentEvents(List<TaskEvent> events) {
        int limit = Math.max(1, recentEventLimit.getAsInt());
        List<TaskEvent> tail = events.size() > limit ? events.subList(events.size() - limit, events.size()) : events;
        List<Map<String, Object>> out = new ArrayList<>(tail.size());
        for (TaskEvent event : tail) {
            out.add(TaskViews.event(event));
        }
        return out;
    }

    private void sendSpawnNotice(ToolContext context, Task task) {
        if (context.conversationId() == null) {
            return;
        }
        String text = "Background task started: " + Texts.preview(task.description(), SPAWN_NOTICE_DESCRIPTION_CHARS)
                + "\nTask ID: " + task.id()
                + "\nMode: " + task.mode().wireName() + " | Priority: " + task.priority().wireName();
        try {
            context.noticeSink().send(context.conversationId(), text);
        } catch (RuntimeException e) {
            log.warn("Failed to send spawn notice for task {}", task.id(), e);
        }
    }

    private static String error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", false);
        out.put("error", message);
        return Jsons.toJson(out);
    }
}
