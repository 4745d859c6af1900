package io.courier.storage;

import io.courier.config.CourierConfig;
import io.courier.model.Task;
import io.courier.model.TaskEvent;
import io.courier.model.TaskEventType;
import io.courier.model.TaskMode;
import io.courier.model.TaskPriority;
import io.courier.model.TaskStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class TaskStoreTest {

    @Test
    void insertWritesPendingTaskAndCreatedEvent() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-insert-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task task = store.insertTask(new TaskStore.NewTask(
                    "summarize inbox", TaskMode.SUBAGENT, TaskPriority.HIGH, "agent", Map.of("conversation_id", "c-1"), now));

            Assertions.assertTrue(task.id().startsWith("tsk_"));
            Assertions.assertEquals(TaskStatus.PENDING, task.status());
            Assertions.assertEquals(TaskMode.SUBAGENT, task.mode());
            Assertions.assertEquals(TaskPriority.HIGH, task.priority());
            Assertions.assertEquals("c-1", task.metadataString("conversation_id"));
            Assertions.assertNull(task.startedAt());
            Assertions.assertNull(task.progress());
            Assertions.assertFalse(task.cancelRequested());

            List<TaskEvent> events = store.listEvents(task.id());
            Assertions.assertEquals(1, events.size());
            Assertions.assertEquals(TaskEventType.CREATED, events.get(0).eventType());
            Assertions.assertEquals("summarize inbox", events.get(0).data().get("description"));
            Assertions.assertEquals("subagent", events.get(0).data().get("mode"));
            Assertions.assertEquals("high", events.get(0).data().get("priority"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void claimSucceedsOnceAndLogsStartedOnlyForTheWinner() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-claim-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task task = insert(store, "claim me", TaskPriority.NORMAL, now);

            Assertions.assertTrue(store.tryClaim(task.id(), now + 1L));
            Assertions.assertFalse(store.tryClaim(task.id(), now + 2L));

            Task running = store.getTask(task.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.RUNNING, running.status());
            Assertions.assertEquals(now + 1L, running.startedAt().toEpochMilli());
            long started = store.listEvents(task.id()).stream()
                    .filter(e -> e.eventType() == TaskEventType.STARTED)
                    .count();
            Assertions.assertEquals(1L, started);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task task = insert(store, "contended", TaskPriority.URGENT, now);

            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                attempts.add(pool.submit(() -> {
                    start.await();
                    return store.tryClaim(task.id(), Instant.now().toEpochMilli());
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            Assertions.assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void completeAndFailOnlyApplyToRunningTasks() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-finish-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task ok = insert(store, "ok", TaskPriority.NORMAL, now);
            Task bad = insert(store, "bad", TaskPriority.NORMAL, now);

            Assertions.assertFalse(store.tryComplete(ok.id(), "too early", now));
            Assertions.assertTrue(store.tryClaim(ok.id(), now));
            String longResult = "r".repeat(450);
            Assertions.assertTrue(store.tryComplete(ok.id(), longResult, now + 5L));
            Assertions.assertFalse(store.tryFail(ok.id(), "late failure", now + 6L));

            Task completed = store.getTask(ok.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, completed.status());
            Assertions.assertEquals(longResult, completed.result());
            Assertions.assertEquals(1.0d, completed.progress());
            Assertions.assertNotNull(completed.completedAt());
            TaskEvent completedEvent = lastEvent(store, ok.id());
            Assertions.assertEquals(TaskEventType.COMPLETED, completedEvent.eventType());
            Assertions.assertEquals(200, ((String) completedEvent.data().get("result")).length());

            Assertions.assertTrue(store.tryClaim(bad.id(), now));
            String longError = "e".repeat(900);
            Assertions.assertTrue(store.tryFail(bad.id(), longError, now + 5L));
            Task failed = store.getTask(bad.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, failed.status());
            Assertions.assertEquals(longError, failed.error());
            Assertions.assertEquals(500, ((String) lastEvent(store, bad.id()).data().get("error")).length());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancellingPendingTaskIsImmediateAndVisibleInEvents() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-cancel-pending-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task task = insert(store, "never mind", TaskPriority.LOW, now);

            TaskStore.CancelResult result = store.cancelTask(task.id(), now + 1L);
            Assertions.assertEquals(TaskStore.CancelOutcome.CANCELLED, result.outcome());
            Assertions.assertEquals(TaskStatus.PENDING, result.previousStatus());
            Assertions.assertTrue(result.accepted());

            Assertions.assertEquals(TaskStatus.CANCELLED, store.getTask(task.id()).orElseThrow().status());
            TaskEvent cancelled = lastEvent(store, task.id());
            Assertions.assertEquals(TaskEventType.CANCELLED, cancelled.eventType());
            Assertions.assertEquals("user_requested", cancelled.data().get("reason"));
            Assertions.assertFalse(store.tryClaim(task.id(), now + 2L));
            Assertions.assertTrue(store.nextPending().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancellingRunningTaskOnlyRaisesTheFlag() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-cancel-running-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task task = insert(store, "long job", TaskPriority.NORMAL, now);
            Assertions.assertTrue(store.tryClaim(task.id(), now));

            TaskStore.CancelResult first = store.cancelTask(task.id(), now + 1L);
            Assertions.assertEquals(TaskStore.CancelOutcome.CANCEL_REQUESTED, first.outcome());
            Task flagged = store.getTask(task.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.RUNNING, flagged.status());
            Assertions.assertTrue(flagged.cancelRequested());
            Assertions.assertTrue(store.isCancellationRequested(task.id()));
            Assertions.assertEquals(TaskEventType.CANCEL_REQUESTED, lastEvent(store, task.id()).eventType());

            TaskStore.CancelResult again = store.cancelTask(task.id(), now + 2L);
            Assertions.assertEquals(TaskStore.CancelOutcome.ALREADY_REQUESTED, again.outcome());
            Assertions.assertTrue(again.accepted());

            Assertions.assertTrue(store.tryMarkCancelled(task.id(), "cancel_requested", now + 3L));
            Assertions.assertEquals(TaskStatus.CANCELLED, store.getTask(task.id()).orElseThrow().status());
            Assertions.assertFalse(store.tryMarkCancelled(task.id(), "cancel_requested", now + 4L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancellingTerminalOrUnknownTaskIsRejected() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-cancel-terminal-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task task = insert(store, "done already", TaskPriority.NORMAL, now);
            store.tryClaim(task.id(), now);
            store.tryComplete(task.id(), "ok", now + 1L);

            TaskStore.CancelResult terminal = store.cancelTask(task.id(), now + 2L);
            Assertions.assertEquals(TaskStore.CancelOutcome.NOT_CANCELLABLE, terminal.outcome());
            Assertions.assertEquals(TaskStatus.COMPLETED, terminal.previousStatus());
            Assertions.assertFalse(terminal.accepted());

            TaskStore.CancelResult missing = store.cancelTask("tsk_missing", now);
            Assertions.assertEquals(TaskStore.CancelOutcome.NOT_FOUND, missing.outcome());
            Assertions.assertFalse(missing.accepted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nextPendingPrefersPriorityThenAgeThenInsertionOrder() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-order-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task low = insert(store, "low", TaskPriority.LOW, now);
            Task normalFirst = insert(store, "normal-1", TaskPriority.NORMAL, now);
            Task normalSecond = insert(store, "normal-2", TaskPriority.NORMAL, now);
            Task high = insert(store, "high", TaskPriority.HIGH, now + 10L);
            Task olderHigh = insert(store, "older-high", TaskPriority.HIGH, now - 10L);
            Task urgent = insert(store, "urgent", TaskPriority.URGENT, now + 20L);

            List<String> order = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                Task next = store.nextPending().orElseThrow();
                Assertions.assertTrue(store.tryClaim(next.id(), now));
                order.add(next.id());
            }
            Assertions.assertEquals(
                    List.of(urgent.id(), olderHigh.id(), high.id(), normalFirst.id(), normalSecond.id(), low.id()),
                    order
            );
            Assertions.assertTrue(store.nextPending().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listAndCountReflectEveryStatus() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-list-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task first = insert(store, "first", TaskPriority.NORMAL, now);
            Task second = insert(store, "second", TaskPriority.NORMAL, now + 1L);
            insert(store, "third", TaskPriority.NORMAL, now + 2L);
            store.tryClaim(first.id(), now);
            store.cancelTask(second.id(), now);

            Map<TaskStatus, Integer> counts = store.countByStatus();
            Assertions.assertEquals(List.of(TaskStatus.values()), List.copyOf(counts.keySet()));
            Assertions.assertEquals(1, counts.get(TaskStatus.PENDING));
            Assertions.assertEquals(1, counts.get(TaskStatus.RUNNING));
            Assertions.assertEquals(0, counts.get(TaskStatus.COMPLETED));
            Assertions.assertEquals(0, counts.get(TaskStatus.FAILED));
            Assertions.assertEquals(1, counts.get(TaskStatus.CANCELLED));

            List<Task> all = store.listTasks(null, 10);
            Assertions.assertEquals(List.of("third", "second", "first"),
                    all.stream().map(Task::description).toList());
            Assertions.assertEquals(List.of("first"),
                    store.listTasks(TaskStatus.RUNNING, 10).stream().map(Task::description).toList());
            Assertions.assertEquals(1, store.listTasks(null, 1).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void interruptedRunningTasksAreFailed() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-recover-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task stuck = insert(store, "stuck", TaskPriority.NORMAL, now);
            Task waiting = insert(store, "waiting", TaskPriority.NORMAL, now);
            store.tryClaim(stuck.id(), now);

            List<String> failed = store.failInterruptedRunning("interrupted by restart", now + 1L);
            Assertions.assertEquals(List.of(stuck.id()), failed);
            Task recovered = store.getTask(stuck.id()).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, recovered.status());
            Assertions.assertEquals("interrupted by restart", recovered.error());
            Assertions.assertEquals(TaskStatus.PENDING, store.getTask(waiting.id()).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void progressIsRecordedOnlyWhileRunning() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-progress-");
        try {
            TaskStore store = openStore(root);
            long now = Instant.now().toEpochMilli();
            Task task = insert(store, "progress", TaskPriority.NORMAL, now);

            Assertions.assertFalse(store.updateProgress(task.id(), 0.5d, "too early", now));
            store.tryClaim(task.id(), now);
            Assertions.assertTrue(store.updateProgress(task.id(), 0.5d, "halfway", now + 1L));

            Task running = store.getTask(task.id()).orElseThrow();
            Assertions.assertEquals(0.5d, running.progress());
            Assertions.assertEquals("halfway", running.progressMessage());
            TaskEvent progress = lastEvent(store, task.id());
            Assertions.assertEquals(TaskEventType.PROGRESS, progress.eventType());
            Assertions.assertEquals(0.5d, ((Number) progress.data().get("progress")).doubleValue());
            Assertions.assertEquals("halfway", progress.data().get("message"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void schemaMigrationsAreRecordedOnce() throws Exception {
        Path root = Files.createTempDirectory("courier-test-store-migrations-");
        try {
            Database db = new Database(CourierConfig.fromRoot(root.toString()));
            db.init();
            db.init();
            List<Database.SchemaMigrationRow> rows = db.listSchemaMigrations();
            Assertions.assertEquals(1, rows.size());
            Assertions.assertEquals("20260301_001_task_listing_index", rows.get(0).version());
            Assertions.assertTrue(rows.get(0).success());
        } finally {
            deleteRecursively(root);
        }
    }

    private static TaskStore openStore(Path root) {
        Database db = new Database(CourierConfig.fromRoot(root.toString()));
        db.init();
        return new TaskStore(db);
    }

    private static Task insert(TaskStore store, String description, TaskPriority priority, long nowMs) {
        return store.insertTask(new TaskStore.NewTask(description, TaskMode.WORKER, priority, "test", Map.of(), nowMs));
    }

    private static TaskEvent lastEvent(TaskStore store, String taskId) {
        List<TaskEvent> events = store.listEvents(taskId);
        return events.get(events.size() - 1);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
