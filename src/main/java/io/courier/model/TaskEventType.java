package io.courier.model;

public enum TaskEventType {
    CREATED("created"),
    STARTED("started"),
    PROGRESS("progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    CANCEL_REQUESTED("cancel_requested");

    private final String wireName;

    TaskEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static TaskEventType fromString(String raw) {
        for (TaskEventType value : values()) {
            if (value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + raw);
    }
}
