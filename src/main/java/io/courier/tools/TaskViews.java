package io.courier.tools;

import io.courier.model.Task;
import io.courier.model.TaskEvent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-ready maps for tasks and events. Field names are the wire names the
 * tools and the CLI both print.
 */
public final class TaskViews {
    private static final int SUMMARY_DESCRIPTION_CHARS = 100;
    private static final int SUMMARY_ERROR_CHARS = 100;

    private TaskViews() {
    }

    public static Map<String, Object> detail(Task task) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", task.id());
        out.put("description", task.description());
        out.put("mode", task.mode().wireName());
        out.put("priority", task.priority().wireName());
        out.put("status", task.status().wireName());
        out.put("created_at", iso(task.createdAt()));
        out.put("created_by", task.createdBy());
        out.put("started_at", iso(task.startedAt()));
        out.put("completed_at", iso(task.completedAt()));
        out.put("result", task.result());
        out.put("error", task.error());
        out.put("progress", task.progress());
        out.put("progress_message", task.progressMessage());
        Map<String, Object> metadata = new LinkedHashMap<>(task.metadata());
        if (task.cancelRequested()) {
            metadata.put("cancel_requested", true);
        }
        out.put("metadata", metadata);
        return out;
    }

    /**
     * Compact row for listings: long text clipped, progress as a percentage
     * and empty optional fields left out.
     */
    public static Map<String, Object> summary(Task task) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", task.id());
        String description = task.description();
        out.put("description", description.length() > SUMMARY_DESCRIPTION_CHARS
                ? description.substring(0, SUMMARY_DESCRIPTION_CHARS) + "..."
                : description);
        out.put("mode", task.mode().wireName());
        out.put("priority", task.priority().wireName());
        out.put("status", task.status().wireName());
        out.put("created_at", iso(task.createdAt()));
        if (task.progress() != null) {
            out.put("progress", Math.round(task.progress() * 100.0d) + "%");
        }
        if (task.progressMessage() != null && !task.progressMessage().isBlank()) {
            out.put("progress_message", task.progressMessage());
        }
        if (task.error() != null && !task.error().isBlank()) {
            String error = task.error();
            out.put("error", error.length() > SUMMARY_ERROR_CHARS ? error.substring(0, SUMMARY_ERROR_CHARS) : error);
        }
        if (task.cancelRequested()) {
            out.put("cancel_requested", true);
        }
        return out;
    }

    public static Map<String, Object> event(TaskEvent event) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", event.id());
        out.put("task_id", event.taskId());
        out.put("event_type", event.eventType().wireName());
        out.put("timestamp", iso(event.timestamp()));
        out.put("data", event.data());
        return out;
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
