package io.courier.runtime;

import io.courier.agent.PrimaryAgent;
import io.courier.agent.SubagentFactory;
import io.courier.agent.ToolRunner;
import io.courier.config.CourierSettings;
import io.courier.model.Task;
import io.courier.model.TaskMode;
import io.courier.model.TaskStatus;
import io.courier.transport.NoticeSink;
import io.courier.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Consumer loop over {@link TaskScheduler}: dequeue, claim, run the strategy
 * for the task's mode, record the outcome. Several executors may share one
 * store; the claim decides which of them runs a task.
 */
public final class TaskExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);
    private static final int NOTICE_PREVIEW_CHARS = 200;

    private final String name;
    private final TaskScheduler scheduler;
    private final Map<TaskMode, ExecutionStrategy> strategies;
    private final Supplier<CourierSettings> settings;
    private final NoticeSink noticeSink;
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong claimsLost = new AtomicLong();
    private volatile boolean running;
    private Thread loopThread;

    public TaskExecutor(String name, TaskScheduler scheduler, Map<TaskMode, ExecutionStrategy> strategies,
                        Supplier<CourierSettings> settings, NoticeSink noticeSink) {
        this.name = name;
        this.scheduler = scheduler;
        this.strategies = new EnumMap<>(strategies);
        this.settings = settings;
        this.noticeSink = noticeSink == null ? NoticeSink.NONE : noticeSink;
    }

    /**
     * Standard strategy set: worker on the tool runner, subagent through the
     * factory, background on the primary agent with the configured polling.
     */
    public static Map<TaskMode, ExecutionStrategy> strategies(ToolRunner toolRunner, SubagentFactory subagents,
                                                               PrimaryAgent primaryAgent, CourierSettings settings) {
        Map<TaskMode, ExecutionStrategy> out = new EnumMap<>(TaskMode.class);
        out.put(TaskMode.WORKER, new WorkerStrategy(toolRunner));
        out.put(TaskMode.SUBAGENT, new SubagentStrategy(subagents));
        out.put(TaskMode.BACKGROUND, new BackgroundStrategy(
                primaryAgent, settings.backgroundPollInterval(), settings.backgroundTimeout()));
        return out;
    }

    public ExecutionOutcome runOnce(Duration timeout) throws InterruptedException {
        Optional<Task> next = scheduler.dequeue(timeout);
        if (next.isEmpty()) {
            return ExecutionOutcome.idle();
        }
        Task task = next.get();
        if (!scheduler.claim(task.id())) {
            claimsLost.incrementAndGet();
            return ExecutionOutcome.claimLost(task.id());
        }
        log.info("[{}] Executing task {} mode={}: {}", name, task.id(), task.mode().wireName(),
                Texts.preview(task.description(), 80));
        ExecutionOutcome outcome = execute(task);
        notifyFinished(task, outcome);
        return outcome;
    }

    private ExecutionOutcome execute(Task task) throws InterruptedException {
        ExecutionContext context = new ExecutionContext(task, scheduler);
        try {
            ExecutionStrategy strategy = strategies.get(task.mode());
            if (strategy == null) {
                throw new IllegalStateException("No execution strategy for mode: " + task.mode().wireName());
            }
            String result = strategy.execute(context);
            context.throwIfCancelled();
            if (scheduler.complete(task.id(), result)) {
                completed.incrementAndGet();
                log.info("[{}] Task {} completed", name, task.id());
                return new ExecutionOutcome(true, task.id(), TaskStatus.COMPLETED, result);
            }
            return settled(task.id(), "Task left running state before completion");
        } catch (TaskCancelledException e) {
            cancelled.incrementAndGet();
            log.info("[{}] Task {} cancelled", name, task.id());
            return new ExecutionOutcome(true, task.id(), TaskStatus.CANCELLED, "Task cancelled");
        } catch (InterruptedException e) {
            scheduler.fail(task.id(), "Executor interrupted");
            failed.incrementAndGet();
            throw e;
        } catch (Exception | Error e) {
            String error = Texts.describe(e);
            log.warn("[{}] Task {} failed: {}", name, task.id(), error, e);
            if (scheduler.fail(task.id(), error)) {
                failed.incrementAndGet();
                return new ExecutionOutcome(true, task.id(), TaskStatus.FAILED, error);
            }
            return settled(task.id(), error);
        } finally {
            if (context.liveSubagents() != 0) {
                log.error("[{}] Task {} leaked {} subagent(s)", name, task.id(), context.liveSubagents());
            }
        }
    }

    private ExecutionOutcome settled(String taskId, String message) {
        TaskStatus status = scheduler.get(taskId).map(Task::status).orElse(null);
        return new ExecutionOutcome(true, taskId, status, message);
    }

    private void notifyFinished(Task task, ExecutionOutcome outcome) {
        String conversationId = task.metadataString("conversation_id");
        if (conversationId == null || outcome.status() == null) {
            return;
        }
        String text = switch (outcome.status()) {
            case COMPLETED -> "Task " + task.id() + " completed: " + Texts.preview(outcome.message(), NOTICE_PREVIEW_CHARS);
            case FAILED -> "Task " + task.id() + " failed: " + Texts.preview(outcome.message(), NOTICE_PREVIEW_CHARS);
            case CANCELLED -> "Task " + task.id() + " was cancelled";
            default -> null;
        };
        if (text == null) {
            return;
        }
        try {
            noticeSink.send(conversationId, text);
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to send task notice for {}", name, task.id(), e);
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::loop, "courier-executor-" + name);
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("[{}] Task executor started", name);
    }

    private void loop() {
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                CourierSettings current = settings.get();
                try {
                    runOnce(current.dequeueTimeout());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException | Error e) {
                    log.error("[{}] Executor loop error", name, e);
                    try {
                        Thread.sleep(current.idleBackoffMs());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            synchronized (this) {
                if (loopThread == Thread.currentThread()) {
                    running = false;
                    loopThread = null;
                }
            }
            log.info("[{}] Task executor stopped", name);
        }
    }

    public void stop() {
        Thread thread;
        synchronized (this) {
            running = false;
            thread = loopThread;
            loopThread = null;
        }
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(5_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public Stats stats() {
        return new Stats(completed.get(), failed.get(), cancelled.get(), claimsLost.get());
    }

    @Override
    public void close() {
        stop();
    }

    public record Stats(long completed, long failed, long cancelled, long claimsLost) {
    }
}
