package io.courier.model;

import java.time.Instant;
import java.util.Map;

public record TaskEvent(
        String id,
        String taskId,
        TaskEventType eventType,
        Instant timestamp,
        Map<String, Object> data
) {
    public TaskEvent {
        data = data == null ? Map.of() : data;
    }
}
