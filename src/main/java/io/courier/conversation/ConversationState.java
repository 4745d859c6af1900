package io.courier.conversation;

import io.courier.model.PendingMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * Buffer and flags for one conversation. All fields are guarded by this
 * object's monitor; the debounce wait parks on the same monitor so a new
 * message wakes it.
 */
public final class ConversationState {
    private final String conversationId;
    private final String participantId;
    private final List<PendingMessage> pending = new ArrayList<>();
    private boolean processing;
    private boolean debouncing;
    private boolean interruptSignal;
    private boolean debounceSignal;

    // Loop ownership, managed by ConversationManager.
    private boolean loopActive;
    private long generation;
    private Future<?> loopFuture;

    public ConversationState(String conversationId, String participantId) {
        this.conversationId = conversationId;
        this.participantId = participantId;
    }

    public String conversationId() {
        return conversationId;
    }

    public String participantId() {
        return participantId;
    }

    public synchronized AddOutcome addMessage(String content, Map<String, Object> metadata) {
        pending.add(PendingMessage.of(content, metadata));
        if (processing) {
            interruptSignal = true;
            return AddOutcome.INTERRUPTED_PROCESSING;
        }
        if (debouncing) {
            debounceSignal = true;
            notifyAll();
            return AddOutcome.INTERRUPTED_DEBOUNCE;
        }
        return AddOutcome.QUEUED;
    }

    /**
     * Drains the buffer. Contents are joined with newlines in arrival order;
     * metadata maps are merged so later messages win on key clashes.
     */
    public synchronized CombinedMessage combinedMessage() {
        if (pending.isEmpty()) {
            return CombinedMessage.EMPTY;
        }
        List<String> parts = new ArrayList<>(pending.size());
        Map<String, Object> merged = new LinkedHashMap<>();
        for (PendingMessage message : pending) {
            parts.add(message.content());
            merged.putAll(message.metadata());
        }
        int count = pending.size();
        pending.clear();
        return new CombinedMessage(String.join("\n", parts), merged, count);
    }

    public synchronized boolean checkInterrupt() {
        boolean raised = interruptSignal;
        interruptSignal = false;
        return raised;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized boolean isProcessing() {
        return processing;
    }

    public synchronized boolean isDebouncing() {
        return debouncing;
    }

    synchronized void setProcessing(boolean processing) {
        this.processing = processing;
        if (processing) {
            debouncing = false;
            interruptSignal = false;
        }
    }

    /**
     * Waits for {@code quiet} without a new message, restarting the window on
     * each one, but never longer than {@code max} in total. Returns false if the
     * loop generation changed while waiting.
     */
    synchronized boolean awaitQuiet(long expectedGeneration, Duration quiet, Duration max) throws InterruptedException {
        if (generation != expectedGeneration) {
            return false;
        }
        debouncing = true;
        debounceSignal = false;
        long now = System.nanoTime();
        long hardDeadline = now + max.toNanos();
        long quietDeadline = now + quiet.toNanos();
        try {
            while (generation == expectedGeneration) {
                now = System.nanoTime();
                if (debounceSignal) {
                    debounceSignal = false;
                    quietDeadline = now + quiet.toNanos();
                }
                long remaining = Math.min(quietDeadline, hardDeadline) - now;
                if (remaining <= 0L) {
                    return true;
                }
                long millis = Math.max(1L, remaining / 1_000_000L);
                wait(millis);
            }
            return false;
        } finally {
            if (generation == expectedGeneration) {
                debouncing = false;
            }
        }
    }

    synchronized long beginLoop() {
        loopActive = true;
        return ++generation;
    }

    synchronized boolean isCurrent(long expectedGeneration) {
        return loopActive && generation == expectedGeneration;
    }

    synchronized boolean isLoopActive() {
        return loopActive;
    }

    synchronized void attachLoop(long expectedGeneration, Future<?> future) {
        if (generation == expectedGeneration && loopActive) {
            loopFuture = future;
        } else {
            future.cancel(true);
        }
    }

    /**
     * Ends the loop if the buffer is empty. The check and the flag flip happen
     * under one lock so a concurrent {@link #addMessage} either lands before
     * (and is picked up) or after (and starts a new loop).
     */
    synchronized boolean finishIfIdle(long expectedGeneration) {
        if (generation != expectedGeneration) {
            return true;
        }
        if (!pending.isEmpty()) {
            return false;
        }
        endLoop();
        return true;
    }

    synchronized void finishLoop(long expectedGeneration) {
        if (generation == expectedGeneration) {
            endLoop();
        }
    }

    /**
     * Invalidates the current loop and clears every flag and buffered message.
     * Returns the loop's future, if any, and whether anything was going on.
     */
    synchronized CancelSnapshot reset() {
        boolean hadWork = loopActive || processing || debouncing || !pending.isEmpty();
        Future<?> future = loopFuture;
        generation++;
        loopActive = false;
        loopFuture = null;
        processing = false;
        debouncing = false;
        interruptSignal = false;
        debounceSignal = false;
        pending.clear();
        notifyAll();
        return new CancelSnapshot(hadWork, future);
    }

    private void endLoop() {
        loopActive = false;
        loopFuture = null;
        processing = false;
        debouncing = false;
    }

    record CancelSnapshot(boolean hadWork, Future<?> loopFuture) {
    }
}
