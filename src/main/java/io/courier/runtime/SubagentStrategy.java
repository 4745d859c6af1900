package io.courier.runtime;

import io.courier.agent.Subagent;
import io.courier.agent.SubagentFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates the task to a fresh subagent and always closes it, whether the run
 * completes, fails or is cancelled.
 */
final class SubagentStrategy implements ExecutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(SubagentStrategy.class);

    private final SubagentFactory factory;

    SubagentStrategy(SubagentFactory factory) {
        this.factory = factory;
    }

    @Override
    public String execute(ExecutionContext context) throws Exception {
        context.checkpoint(0.1, "Spawning subagent");
        Subagent subagent = factory.spawn(context.taskId(), context.description());
        context.trackSubagent(subagent);
        try {
            context.checkpoint(0.2, "Subagent spawned: " + subagent.id());
            String result = subagent.run(context.description());
            context.checkpoint(0.8, "Subagent completed");
            return result;
        } finally {
            try {
                subagent.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close subagent {} for task {}", subagent.id(), context.taskId(), e);
            }
            context.releaseSubagent(subagent);
        }
    }
}
