package io.courier.conversation;

/**
 * Polled by a running callback. Returns true once per burst of messages that
 * arrived since the last check.
 */
@FunctionalInterface
public interface InterruptCheck {
    boolean interrupted();
}
