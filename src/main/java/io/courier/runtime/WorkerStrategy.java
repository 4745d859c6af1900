package io.courier.runtime;

import io.courier.agent.ToolRunner;

final class WorkerStrategy implements ExecutionStrategy {
    private final ToolRunner toolRunner;

    WorkerStrategy(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    @Override
    public String execute(ExecutionContext context) throws Exception {
        context.checkpoint(0.1, "Starting worker execution");
        context.checkpoint(0.5, "Running " + toolRunner.id());
        String result = toolRunner.run(context.description());
        context.checkpoint(0.9, "Processing results");
        return result;
    }
}
