package io.courier.conversation;

import java.util.Map;

/**
 * Handles one combined batch for a conversation and delivers any reply itself.
 * Runs on the conversation's loop thread; a cancel interrupts that thread.
 */
@FunctionalInterface
public interface ProcessCallback {
    void process(String conversationId, String participantId, String content, Map<String, Object> metadata,
                 InterruptCheck interruptCheck) throws Exception;
}
