package io.courier.model;

public enum TaskMode {
    /** Runs tools directly in-process. */
    WORKER("worker"),
    /** Spawns an ephemeral delegate agent scoped to the task. */
    SUBAGENT("subagent"),
    /** Hands the task to the primary agent's asynchronous run mechanism. */
    BACKGROUND("background");

    private final String wireName;

    TaskMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static TaskMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return WORKER;
        }
        for (TaskMode value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown mode: " + raw);
    }
}
