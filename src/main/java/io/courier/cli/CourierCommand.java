package io.courier.cli;

import io.courier.config.CourierConfig;
import io.courier.config.SettingsLoader;
import io.courier.conversation.ConversationManager;
import io.courier.conversation.ProcessCallback;
import io.courier.model.TaskStatus;
import io.courier.runtime.CourierRuntime;
import io.courier.runtime.ExecutionOutcome;
import io.courier.runtime.TaskExecutor;
import io.courier.tools.ToolContext;
import io.courier.transport.NoticeSink;
import io.courier.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "courier",
        mixinStandardHelpOptions = true,
        description = "Courier conversation and background task runtime CLI",
        subcommands = {
                CourierCommand.InitCommand.class,
                CourierCommand.SpawnCommand.class,
                CourierCommand.TasksCommand.class,
                CourierCommand.TaskCommand.class,
                CourierCommand.CancelCommand.class,
                CourierCommand.StatsCommand.class,
                CourierCommand.WorkerCommand.class,
                CourierCommand.ChatCommand.class,
                CourierCommand.AuditTailCommand.class,
                CourierCommand.AuditVerifyCommand.class,
                CourierCommand.SchemaMigrationsCommand.class
        }
)
public final class CourierCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    PrintStream out = System.out;

    @Override
    public void run() {
        out.println("Use subcommands: init | spawn | tasks | task | cancel | stats | worker | chat | audit-tail | audit-verify | schema-migrations");
    }

    CourierRuntime runtime() {
        return runtime(NoticeSink.NONE);
    }

    CourierRuntime runtime(NoticeSink noticeSink) {
        CourierRuntime runtime = new CourierRuntime(CourierConfig.fromRoot(root), noticeSink);
        runtime.init();
        return runtime;
    }

    NoticeSink stdoutNotices() {
        return (conversationId, text) -> out.println("[notice " + conversationId + "] " + text);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                parent.out.println("Initialized Courier at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "spawn", description = "Queue a background task")
    static final class SpawnCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Parameters(index = "0", description = "What the task should do")
        String description;

        @Option(names = {"--mode"}, defaultValue = "worker", description = "Execution mode: worker|subagent|background")
        String mode;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "Priority: low|normal|high|urgent")
        String priority;

        @Option(names = {"--conversation"}, description = "Conversation to notify when the task finishes")
        String conversationId;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                String json = runtime.tools().spawnTask(
                        new ToolContext("cli", conversationId, parent.stdoutNotices()), description, mode, priority);
                parent.out.println(json);
                return succeeded(json) ? 0 : 1;
            }
        }
    }

    @Command(name = "tasks", description = "List tasks, newest first")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Option(names = {"--status"}, defaultValue = "", description = "Filter: pending|running|completed|failed|cancelled")
        String status;

        @Option(names = {"--limit"}, defaultValue = "10", description = "Maximum rows")
        int limit;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                String json = runtime.tools().listTasks(status, limit);
                parent.out.println(json);
                return succeeded(json) ? 0 : 1;
            }
        }
    }

    @Command(name = "task", description = "Show one task with its recent events")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                String json = runtime.tools().getTaskStatus(taskId);
                parent.out.println(json);
                return succeeded(json) ? 0 : 1;
            }
        }
    }

    @Command(name = "cancel", description = "Cancel a pending task or request cancellation of a running one")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                String json = runtime.tools().cancelTask(taskId);
                parent.out.println(json);
                return succeeded(json) ? 0 : 1;
            }
        }
    }

    @Command(name = "stats", description = "Task counts by status")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                Map<String, Object> stats = new LinkedHashMap<>();
                int total = 0;
                for (Map.Entry<TaskStatus, Integer> entry : runtime.scheduler().stats().entrySet()) {
                    stats.put(entry.getKey().wireName(), entry.getValue());
                    total += entry.getValue();
                }
                stats.put("total", total);
                parent.out.println(Jsons.toJson(stats));
            }
            return 0;
        }
    }

    @Command(name = "worker", description = "Run the task executor loop or a single cycle")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one dequeue/execute cycle")
        boolean once;

        @Option(names = {"--timeout-ms"}, defaultValue = "0",
                description = "Dequeue wait for --once; 0 means the configured dequeue timeout")
        long timeoutMs;

        @Option(names = {"--settings-reload-ms"}, defaultValue = "10000",
                description = "Check interval for hot-reloading courier-settings.json")
        long settingsReloadMs;

        @Override
        public Integer call() throws Exception {
            try (CourierRuntime runtime = parent.runtime(parent.stdoutNotices())) {
                List<String> recovered = runtime.scheduler().recover();
                if (!recovered.isEmpty()) {
                    parent.out.println(Jsons.toJson(Map.of("recovered", recovered)));
                }
                TaskExecutor executor = runtime.executor();
                if (once) {
                    Duration wait = timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : runtime.settings().dequeueTimeout();
                    ExecutionOutcome outcome = executor.runOnce(wait);
                    parent.out.println(Jsons.toJson(outcome));
                    return 0;
                }

                AtomicBoolean running = new AtomicBoolean(true);
                Thread main = Thread.currentThread();
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    running.set(false);
                    main.interrupt();
                }, "courier-shutdown-hook"));
                executor.start();
                try {
                    while (running.get()) {
                        SettingsLoader.ReloadOutcome reload = runtime.maybeReloadSettings(settingsReloadMs);
                        if (reload.changed()) {
                            parent.out.println(Jsons.toJson(reload));
                        }
                        Thread.sleep(Math.max(1_000L, settingsReloadMs));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    executor.stop();
                }
                parent.out.println(Jsons.toJson(executor.stats()));
                return 0;
            }
        }
    }

    /**
     * Line-oriented conversation over stdin. Lines starting with {@code /spawn}
     * queue a worker task, {@code /cancel} aborts the conversation, anything else
     * is echoed back after processing.
     */
    @Command(name = "chat", description = "Interactive conversation on stdin with a local executor")
    static final class ChatCommand implements Callable<Integer> {
        private static final String CONVERSATION_ID = "cli";

        @ParentCommand
        CourierCommand parent;

        @Option(names = {"--participant"}, defaultValue = "local", description = "Participant id")
        String participantId;

        @Override
        public Integer call() throws Exception {
            NoticeSink notices = parent.stdoutNotices();
            try (CourierRuntime runtime = parent.runtime(notices)) {
                runtime.scheduler().recover();
                runtime.executor().start();
                ConversationManager conversations = runtime.conversations();
                ProcessCallback callback = (conversationId, participant, content, metadata, interruptCheck) -> {
                    for (String line : content.split("\n")) {
                        if (interruptCheck.interrupted()) {
                            parent.out.println("[assistant] interrupted, picking up new messages");
                            return;
                        }
                        String trimmed = line.trim();
                        if (trimmed.startsWith("/spawn ")) {
                            parent.out.println(runtime.tools().spawnTask(
                                    ToolContext.agent(conversationId, notices),
                                    trimmed.substring("/spawn ".length()), "worker", "normal"));
                        } else if (!trimmed.isEmpty()) {
                            parent.out.println("[assistant] " + trimmed);
                        }
                    }
                };

                BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.trim().equals("/cancel")) {
                        parent.out.println(Jsons.toJson(Map.of("cancelled", conversations.cancel(CONVERSATION_ID))));
                        continue;
                    }
                    conversations.addMessage(CONVERSATION_ID, participantId, line, Map.of(), callback);
                }
                awaitIdle(conversations, runtime.settings().maxDebounce().plusSeconds(5));
            }
            return 0;
        }

        private static void awaitIdle(ConversationManager conversations, Duration limit) throws InterruptedException {
            long deadline = System.nanoTime() + limit.toNanos();
            while (System.nanoTime() < deadline && conversations.activeConversations().contains(CONVERSATION_ID)) {
                Thread.sleep(50L);
            }
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                for (String row : runtime.auditTail(lines)) {
                    parent.out.println(row);
                }
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                int broken = runtime.verifyAudit();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("valid", broken == 0);
                out.put("first_broken_line", broken);
                parent.out.println(Jsons.toJson(out));
                return broken == 0 ? 0 : 1;
            }
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        CourierCommand parent;

        @Override
        public Integer call() {
            try (CourierRuntime runtime = parent.runtime()) {
                parent.out.println(Jsons.toJson(runtime.schemaMigrations()));
            }
            return 0;
        }
    }

    private static boolean succeeded(String json) {
        return Boolean.TRUE.equals(Jsons.readMap(json).get("success"));
    }
}
