package io.courier.agent;

import io.courier.util.Texts;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs background requests through a {@link ToolRunner} on its own thread pool
 * and exposes them as pollable runs.
 */
public final class ThreadedPrimaryAgent implements PrimaryAgent, AutoCloseable {
    private final ToolRunner toolRunner;
    private final ExecutorService pool;

    public ThreadedPrimaryAgent(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "courier-primary-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public RunHandle submit(String description) {
        String prompt = "[BACKGROUND TASK]\n\nPlease complete this task in the background:\n\n"
                + description + "\n\nWhen done, summarize your results.";
        Future<String> future = pool.submit(() -> toolRunner.run(prompt));
        return new FutureRunHandle("run_" + UUID.randomUUID(), future);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private static final class FutureRunHandle implements RunHandle {
        private final String runId;
        private final Future<String> future;

        private FutureRunHandle(String runId, Future<String> future) {
            this.runId = runId;
            this.future = future;
        }

        @Override
        public String runId() {
            return runId;
        }

        @Override
        public RunStatus poll() {
            if (!future.isDone()) {
                return RunStatus.RUNNING;
            }
            if (future.isCancelled()) {
                return RunStatus.CANCELLED;
            }
            try {
                future.get();
                return RunStatus.COMPLETED;
            } catch (ExecutionException e) {
                return RunStatus.FAILED;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RunStatus.RUNNING;
            }
        }

        @Override
        public String result() throws ExecutionException, InterruptedException {
            return future.get();
        }

        @Override
        public String error() {
            if (!future.isDone() || future.isCancelled()) {
                return null;
            }
            try {
                future.get();
                return null;
            } catch (ExecutionException e) {
                return Texts.describe(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Texts.describe(e);
            }
        }

        @Override
        public void cancel() {
            future.cancel(true);
        }
    }
}
