package io.courier.conversation;

/**
 * What an incoming message did to the conversation: cut into a running
 * callback, or restarted the debounce window. Both false for a message that
 * simply queued or started a new loop.
 */
public record AddOutcome(boolean interruptedProcessing, boolean interruptedDebounce) {
    static final AddOutcome QUEUED = new AddOutcome(false, false);
    static final AddOutcome INTERRUPTED_PROCESSING = new AddOutcome(true, false);
    static final AddOutcome INTERRUPTED_DEBOUNCE = new AddOutcome(false, true);
}
