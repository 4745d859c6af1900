package io.courier.model;

import java.time.Instant;
import java.util.Map;

public record PendingMessage(String content, Map<String, Object> metadata, Instant createdAt) {
    public PendingMessage {
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : metadata;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static PendingMessage of(String content, Map<String, Object> metadata) {
        return new PendingMessage(content, metadata, Instant.now());
    }
}
