package io.courier.model;

public enum TaskPriority {
    URGENT("urgent", 0),
    HIGH("high", 1),
    NORMAL("normal", 2),
    LOW("low", 3);

    private final String wireName;
    private final int rank;

    TaskPriority(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Dequeue rank, lower runs first.
     */
    public int rank() {
        return rank;
    }

    public static TaskPriority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (TaskPriority value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
