package io.courier.agent;

/**
 * Pollable view of an asynchronous run on the primary agent.
 */
public interface RunHandle {
    String runId();

    RunStatus poll() throws Exception;

    /** Output of a {@link RunStatus#COMPLETED} run. */
    String result() throws Exception;

    /** Failure text of a {@link RunStatus#FAILED} run. */
    String error();

    void cancel();
}
