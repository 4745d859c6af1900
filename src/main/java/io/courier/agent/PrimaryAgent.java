package io.courier.agent;

public interface PrimaryAgent {
    RunHandle submit(String description) throws Exception;
}
