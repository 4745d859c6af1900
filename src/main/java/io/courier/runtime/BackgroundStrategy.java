package io.courier.runtime;

import io.courier.agent.PrimaryAgent;
import io.courier.agent.RunHandle;
import io.courier.agent.RunStatus;

import java.time.Duration;

/**
 * Submits the task to the primary agent and polls the run until it finishes or
 * the timeout passes. The run is cancelled on every exit other than success.
 */
final class BackgroundStrategy implements ExecutionStrategy {
    private final PrimaryAgent agent;
    private final Duration pollInterval;
    private final Duration timeout;

    BackgroundStrategy(PrimaryAgent agent, Duration pollInterval, Duration timeout) {
        this.agent = agent;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
    }

    @Override
    public String execute(ExecutionContext context) throws Exception {
        context.checkpoint(0.1, "Submitting to primary agent");
        RunHandle handle = agent.submit(context.description());
        boolean finished = false;
        try {
            context.checkpoint(0.3, "Running in background: " + handle.runId());
            long startedNs = System.nanoTime();
            long timeoutNs = timeout.toNanos();
            while (true) {
                RunStatus status = handle.poll();
                if (status == RunStatus.COMPLETED) {
                    String result = handle.result();
                    finished = true;
                    context.checkpoint(0.95, "Background run completed");
                    return result;
                }
                if (status == RunStatus.FAILED) {
                    finished = true;
                    throw new IllegalStateException("Agent run failed: " + handle.error());
                }
                if (status == RunStatus.CANCELLED) {
                    finished = true;
                    throw new IllegalStateException("Agent run was cancelled");
                }

                long elapsedNs = System.nanoTime() - startedNs;
                if (elapsedNs >= timeoutNs) {
                    throw new TaskTimeoutException(context.taskId(), timeout);
                }
                double fraction = timeoutNs == 0L ? 1.0d : (double) elapsedNs / timeoutNs;
                context.checkpoint(0.3 + 0.6 * Math.min(1.0d, fraction), "Waiting for background run");
                long sleepMs = Math.max(1L, Math.min(pollInterval.toMillis(), (timeoutNs - elapsedNs) / 1_000_000L));
                Thread.sleep(sleepMs);
            }
        } finally {
            if (!finished) {
                handle.cancel();
            }
        }
    }
}
