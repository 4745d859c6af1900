package io.courier.agent;

/**
 * An ephemeral delegate agent scoped to one task. {@link #close()} releases it
 * and is called exactly once by the executor, whatever the outcome.
 */
public interface Subagent extends AutoCloseable {
    String id();

    String run(String description) throws Exception;

    @Override
    void close();
}
