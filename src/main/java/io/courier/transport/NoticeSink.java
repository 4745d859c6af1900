package io.courier.transport;

/**
 * Outbound plain-text notices addressed to a conversation, used for task
 * completion and processing errors. Delivery is best effort.
 */
@FunctionalInterface
public interface NoticeSink {
    NoticeSink NONE = (conversationId, text) -> {
    };

    void send(String conversationId, String text);
}
