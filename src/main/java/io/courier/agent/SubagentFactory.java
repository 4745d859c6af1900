package io.courier.agent;

public interface SubagentFactory {
    Subagent spawn(String taskId, String description) throws Exception;
}
