package io.courier.conversation;

import java.util.Map;

public record CombinedMessage(String content, Map<String, Object> metadata, int messageCount) {
    public static final CombinedMessage EMPTY = new CombinedMessage("", Map.of(), 0);

    public boolean isEmpty() {
        return messageCount == 0;
    }
}
