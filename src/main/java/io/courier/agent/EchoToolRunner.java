package io.courier.agent;

public final class EchoToolRunner implements ToolRunner {
    @Override
    public String id() {
        return "echo";
    }

    @Override
    public String run(String description) {
        return "Worker mode executed for: " + description;
    }
}
