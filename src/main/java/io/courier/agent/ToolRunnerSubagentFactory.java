package io.courier.agent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Local stand-in for a remote agent service: every subagent delegates to the
 * same {@link ToolRunner} but keeps its own identity and lifecycle.
 */
public final class ToolRunnerSubagentFactory implements SubagentFactory {
    private final ToolRunner toolRunner;

    public ToolRunnerSubagentFactory(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    @Override
    public Subagent spawn(String taskId, String description) {
        String shortId = taskId.length() > 12 ? taskId.substring(4, 12) : taskId;
        return new LocalSubagent("task-worker-" + shortId, toolRunner);
    }

    private static final class LocalSubagent implements Subagent {
        private final String id;
        private final ToolRunner toolRunner;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private LocalSubagent(String id, ToolRunner toolRunner) {
            this.id = id;
            this.toolRunner = toolRunner;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String run(String description) throws Exception {
            if (closed.get()) {
                throw new IllegalStateException("subagent already closed: " + id);
            }
            return toolRunner.run("Please complete this task:\n\n" + description);
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}
