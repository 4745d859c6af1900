package io.courier.agent;

/**
 * Runs tools directly in-process for a {@code worker} task.
 */
public interface ToolRunner {
    String id();

    String run(String description) throws Exception;
}
