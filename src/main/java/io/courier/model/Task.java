package io.courier.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Task(
        String id,
        String description,
        TaskMode mode,
        TaskPriority priority,
        TaskStatus status,
        Instant createdAt,
        String createdBy,
        Instant startedAt,
        Instant completedAt,
        String result,
        String error,
        Double progress,
        String progressMessage,
        Map<String, Object> metadata,
        boolean cancelRequested
) {
    public Task {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : String.valueOf(value);
    }
}
