package io.courier.storage;

import io.courier.config.CourierConfig;
import io.courier.model.Task;
import io.courier.model.TaskEvent;
import io.courier.model.TaskEventType;
import io.courier.model.TaskMode;
import io.courier.model.TaskPriority;
import io.courier.model.TaskStatus;
import io.courier.util.Jsons;
import io.courier.util.Texts;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable task table and its append-only event log.
 *
 * <p>Every status change is a conditional {@code UPDATE ... WHERE status=?}; the
 * event row is written in the same transaction only when the update matched, so
 * the log never records a transition that lost its race. Enum values cross into
 * SQL as their wire names here and nowhere else.
 */
public final class TaskStore {
    private static final String PRIORITY_RANK = """
            CASE priority WHEN 'urgent' THEN 0 WHEN 'high' THEN 1 WHEN 'normal' THEN 2 WHEN 'low' THEN 3 ELSE 4 END""";
    private static final String TASK_COLUMNS = """
            id,description,mode,priority,status,created_at_ms,created_by,started_at_ms,completed_at_ms,
            result,error,progress,progress_message,metadata,cancel_requested""";

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    public Task insertTask(NewTask t) {
        String id = "tsk_" + UUID.randomUUID();
        Map<String, Object> metadata = t.metadata() == null ? Map.of() : t.metadata();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO tasks(id,description,mode,priority,status,created_at_ms,created_by,metadata,cancel_requested) VALUES(?,?,?,?,?,?,?,?,0)")) {
                ps.setString(1, id);
                ps.setString(2, t.description());
                ps.setString(3, t.mode().wireName());
                ps.setString(4, t.priority().wireName());
                ps.setString(5, TaskStatus.PENDING.wireName());
                ps.setLong(6, t.nowMs());
                ps.setString(7, t.createdBy());
                ps.setString(8, Jsons.toCompactJson(metadata));
                ps.executeUpdate();

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("description", t.description());
                data.put("mode", t.mode().wireName());
                data.put("priority", t.priority().wireName());
                appendEvent(c, id, TaskEventType.CREATED, t.nowMs(), data);
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert task", e);
        }
        return getTask(id).orElseThrow(() -> new IllegalStateException("Task vanished after insert: " + id));
    }

    public Optional<Task> getTask(String taskId) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readTask(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load task: " + taskId, e);
        }
    }

    /**
     * Highest priority first, then oldest, then insertion order for ties within
     * the same millisecond.
     */
    public Optional<Task> nextPending() {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=? ORDER BY "
                + PRIORITY_RANK + " ASC, created_at_ms ASC, rowid ASC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.PENDING.wireName());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readTask(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to select next pending task", e);
        }
    }

    public List<Task> listTasks(TaskStatus status, int limit) {
        int safeLimit = Math.max(1, limit);
        String sql = status == null
                ? "SELECT " + TASK_COLUMNS + " FROM tasks ORDER BY created_at_ms DESC, rowid DESC LIMIT ?"
                : "SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=? ORDER BY created_at_ms DESC, rowid DESC LIMIT ?";
        List<Task> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.wireName());
            }
            ps.setInt(idx, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    public boolean tryClaim(String taskId, long nowMs) {
        return transition(
                "UPDATE tasks SET status=?,started_at_ms=? WHERE id=? AND status=?",
                ps -> {
                    ps.setString(1, TaskStatus.RUNNING.wireName());
                    ps.setLong(2, nowMs);
                    ps.setString(3, taskId);
                    ps.setString(4, TaskStatus.PENDING.wireName());
                },
                taskId, TaskEventType.STARTED, nowMs, Map.of(), "claim");
    }

    public boolean updateProgress(String taskId, double progress, String message, long nowMs) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("progress", progress);
        data.put("message", message);
        return transition(
                "UPDATE tasks SET progress=?,progress_message=? WHERE id=? AND status=?",
                ps -> {
                    ps.setDouble(1, progress);
                    ps.setString(2, message);
                    ps.setString(3, taskId);
                    ps.setString(4, TaskStatus.RUNNING.wireName());
                },
                taskId, TaskEventType.PROGRESS, nowMs, data, "update progress");
    }

    public boolean tryComplete(String taskId, String result, long nowMs) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("result", Texts.truncate(result, CourierConfig.EVENT_RESULT_MAX_CHARS));
        return transition(
                "UPDATE tasks SET status=?,completed_at_ms=?,result=?,progress=1.0 WHERE id=? AND status=?",
                ps -> {
                    ps.setString(1, TaskStatus.COMPLETED.wireName());
                    ps.setLong(2, nowMs);
                    ps.setString(3, result);
                    ps.setString(4, taskId);
                    ps.setString(5, TaskStatus.RUNNING.wireName());
                },
                taskId, TaskEventType.COMPLETED, nowMs, data, "complete");
    }

    public boolean tryFail(String taskId, String error, long nowMs) {
        String safeError = error == null ? "" : error;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", Texts.truncate(safeError, CourierConfig.EVENT_ERROR_MAX_CHARS));
        return transition(
                "UPDATE tasks SET status=?,completed_at_ms=?,error=? WHERE id=? AND status=?",
                ps -> {
                    ps.setString(1, TaskStatus.FAILED.wireName());
                    ps.setLong(2, nowMs);
                    ps.setString(3, safeError);
                    ps.setString(4, taskId);
                    ps.setString(5, TaskStatus.RUNNING.wireName());
                },
                taskId, TaskEventType.FAILED, nowMs, data, "fail");
    }

    /**
     * Running to cancelled, once the executor has observed the cooperative flag.
     */
    public boolean tryMarkCancelled(String taskId, String reason, long nowMs) {
        return transition(
                "UPDATE tasks SET status=?,completed_at_ms=? WHERE id=? AND status=?",
                ps -> {
                    ps.setString(1, TaskStatus.CANCELLED.wireName());
                    ps.setLong(2, nowMs);
                    ps.setString(3, taskId);
                    ps.setString(4, TaskStatus.RUNNING.wireName());
                },
                taskId, TaskEventType.CANCELLED, nowMs, Map.of("reason", reason), "mark cancelled");
    }

    /**
     * Pending tasks are cancelled outright. Running tasks only get the
     * cooperative flag. If the task is claimed between the two updates the
     * second one still matches, so a cancel is never lost to that race.
     */
    public CancelResult cancelTask(String taskId, long nowMs) {
        boolean cancelled = transition(
                "UPDATE tasks SET status=?,completed_at_ms=? WHERE id=? AND status=?",
                ps -> {
                    ps.setString(1, TaskStatus.CANCELLED.wireName());
                    ps.setLong(2, nowMs);
                    ps.setString(3, taskId);
                    ps.setString(4, TaskStatus.PENDING.wireName());
                },
                taskId, TaskEventType.CANCELLED, nowMs, Map.of("reason", "user_requested"), "cancel pending");
        if (cancelled) {
            return new CancelResult(taskId, CancelOutcome.CANCELLED, TaskStatus.PENDING);
        }
        boolean flagged = transition(
                "UPDATE tasks SET cancel_requested=1 WHERE id=? AND status=? AND cancel_requested=0",
                ps -> {
                    ps.setString(1, taskId);
                    ps.setString(2, TaskStatus.RUNNING.wireName());
                },
                taskId, TaskEventType.CANCEL_REQUESTED, nowMs, Map.of(), "request cancel");
        if (flagged) {
            return new CancelResult(taskId, CancelOutcome.CANCEL_REQUESTED, TaskStatus.RUNNING);
        }
        Optional<Task> current = getTask(taskId);
        if (current.isEmpty()) {
            return new CancelResult(taskId, CancelOutcome.NOT_FOUND, null);
        }
        Task task = current.get();
        if (task.status() == TaskStatus.RUNNING && task.cancelRequested()) {
            return new CancelResult(taskId, CancelOutcome.ALREADY_REQUESTED, TaskStatus.RUNNING);
        }
        return new CancelResult(taskId, CancelOutcome.NOT_CANCELLABLE, task.status());
    }

    public boolean isCancellationRequested(String taskId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT cancel_requested FROM tasks WHERE id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) == 1;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cancel flag: " + taskId, e);
        }
    }

    public List<TaskEvent> listEvents(String taskId) {
        String sql = "SELECT id,task_id,event_type,timestamp_ms,data FROM task_events WHERE task_id=? ORDER BY timestamp_ms ASC, rowid ASC";
        List<TaskEvent> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TaskEvent(
                            rs.getString("id"),
                            rs.getString("task_id"),
                            TaskEventType.fromString(rs.getString("event_type")),
                            Instant.ofEpochMilli(rs.getLong("timestamp_ms")),
                            Jsons.readMap(rs.getString("data"))
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list task events: " + taskId, e);
        }
    }

    public Map<TaskStatus, Integer> countByStatus() {
        Map<TaskStatus, Integer> out = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            out.put(status, 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status,COUNT(*) AS n FROM tasks GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(TaskStatus.fromString(rs.getString("status")), rs.getInt("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status", e);
        }
    }

    /**
     * Fails every task still marked running. Only safe before any executor of
     * this store has started.
     */
    public List<String> failInterruptedRunning(String error, long nowMs) {
        List<String> ids = new ArrayList<>();
        for (Task task : listTasks(TaskStatus.RUNNING, Integer.MAX_VALUE)) {
            if (tryFail(task.id(), error, nowMs)) {
                ids.add(task.id());
            }
        }
        return ids;
    }

    private boolean transition(String sql, Binder binder, String taskId, TaskEventType eventType, long nowMs,
                               Map<String, Object> eventData, String action) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                binder.bind(ps);
                int updated = ps.executeUpdate();
                if (updated != 1) {
                    c.rollback();
                    return false;
                }
                appendEvent(c, taskId, eventType, nowMs, eventData);
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + action + " task: " + taskId, e);
        }
    }

    private void appendEvent(Connection c, String taskId, TaskEventType type, long nowMs, Map<String, Object> data)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO task_events(id,task_id,event_type,timestamp_ms,data) VALUES(?,?,?,?,?)")) {
            ps.setString(1, "evt_" + UUID.randomUUID());
            ps.setString(2, taskId);
            ps.setString(3, type.wireName());
            ps.setLong(4, nowMs);
            ps.setString(5, Jsons.toCompactJson(data == null ? Map.of() : data));
            ps.executeUpdate();
        }
    }

    private Task readTask(ResultSet rs) throws SQLException {
        double progress = rs.getDouble("progress");
        Double progressValue = rs.wasNull() ? null : progress;
        return new Task(
                rs.getString("id"),
                rs.getString("description"),
                TaskMode.fromString(rs.getString("mode")),
                TaskPriority.fromString(rs.getString("priority")),
                TaskStatus.fromString(rs.getString("status")),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                rs.getString("created_by"),
                nullableInstant(rs, "started_at_ms"),
                nullableInstant(rs, "completed_at_ms"),
                rs.getString("result"),
                rs.getString("error"),
                progressValue,
                rs.getString("progress_message"),
                Jsons.readMap(rs.getString("metadata")),
                rs.getInt("cancel_requested") == 1
        );
    }

    private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public record NewTask(String description, TaskMode mode, TaskPriority priority, String createdBy,
                          Map<String, Object> metadata, long nowMs) {}
    public enum CancelOutcome { CANCELLED, CANCEL_REQUESTED, ALREADY_REQUESTED, NOT_CANCELLABLE, NOT_FOUND }
    public record CancelResult(String taskId, CancelOutcome outcome, TaskStatus previousStatus) {
        public boolean accepted() {
            return outcome == CancelOutcome.CANCELLED
                    || outcome == CancelOutcome.CANCEL_REQUESTED
                    || outcome == CancelOutcome.ALREADY_REQUESTED;
        }
    }
}
