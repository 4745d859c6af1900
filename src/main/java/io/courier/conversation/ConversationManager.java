package io.courier.conversation;

import io.courier.config.CourierSettings;
import io.courier.observability.AuditLogger;
import io.courier.transport.NoticeSink;
import io.courier.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Serializes processing per conversation. The first message of an idle
 * conversation is handed to the callback at once; messages that arrive while
 * it runs raise the interrupt signal and are batched, after a debounce, into
 * the next call.
 */
public final class ConversationManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConversationManager.class);
    private static final String ACTOR = "conversation-manager";

    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();
    private final Supplier<CourierSettings> settings;
    private final NoticeSink noticeSink;
    private final AuditLogger auditLogger;
    private final ExecutorService loops;

    public ConversationManager(Supplier<CourierSettings> settings, NoticeSink noticeSink, AuditLogger auditLogger) {
        this.settings = settings;
        this.noticeSink = noticeSink == null ? NoticeSink.NONE : noticeSink;
        this.auditLogger = auditLogger;
        AtomicInteger counter = new AtomicInteger();
        this.loops = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "courier-conversation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ConversationState stateFor(String conversationId, String participantId) {
        return states.computeIfAbsent(conversationId, id -> new ConversationState(id, participantId));
    }

    public AddOutcome addMessage(String conversationId, String participantId, String content,
                                 Map<String, Object> metadata, ProcessCallback callback) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId cannot be empty");
        }
        ConversationState state = stateFor(conversationId, participantId);
        AddOutcome outcome;
        CombinedMessage first = null;
        long generation = 0L;
        synchronized (state) {
            outcome = state.addMessage(content, metadata);
            if (!state.isLoopActive()) {
                generation = state.beginLoop();
                first = state.combinedMessage();
                state.setProcessing(true);
            }
        }
        if (first != null) {
            CombinedMessage batch = first;
            long loopGeneration = generation;
            Future<?> future = loops.submit(() -> runLoop(state, loopGeneration, batch, callback));
            state.attachLoop(loopGeneration, future);
            log.debug("Started processing loop for conversation {}", conversationId);
        } else if (outcome.interruptedProcessing()) {
            log.debug("Message interrupted processing for conversation {}", conversationId);
        }
        return outcome;
    }

    private void runLoop(ConversationState state, long generation, CombinedMessage first, ProcessCallback callback) {
        CombinedMessage batch = first;
        try {
            while (state.isCurrent(generation)) {
                if (batch == null) {
                    if (state.finishIfIdle(generation)) {
                        return;
                    }
                    CourierSettings current = settings.get();
                    if (!state.awaitQuiet(generation, current.debounce(), current.maxDebounce())) {
                        return;
                    }
                    synchronized (state) {
                        if (!state.isCurrent(generation)) {
                            return;
                        }
                        batch = state.combinedMessage();
                        if (batch.isEmpty()) {
                            batch = null;
                            continue;
                        }
                        state.setProcessing(true);
                    }
                }
                invoke(state, generation, batch, callback);
                batch = null;
            }
        } catch (InterruptedException e) {
            log.debug("Processing loop for conversation {} interrupted", state.conversationId());
        } finally {
            state.finishLoop(generation);
        }
    }

    private void invoke(ConversationState state, long generation, CombinedMessage batch, ProcessCallback callback) {
        String conversationId = state.conversationId();
        try {
            log.info("Processing {} message(s) for conversation {}", batch.messageCount(), conversationId);
            callback.process(conversationId, state.participantId(), batch.content(), batch.metadata(),
                    state::checkInterrupt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception | Error e) {
            if (state.isCurrent(generation)) {
                log.warn("Processing failed for conversation {}", conversationId, e);
                sendNotice(conversationId, "Error: " + Texts.describe(e));
            }
        } finally {
            synchronized (state) {
                if (state.isCurrent(generation)) {
                    state.setProcessing(false);
                }
            }
        }
    }

    /**
     * Aborts whatever the conversation is doing: interrupts a running callback,
     * ends a debounce wait and drops buffered messages.
     */
    public boolean cancel(String conversationId) {
        ConversationState state = states.get(conversationId);
        if (state == null) {
            return false;
        }
        ConversationState.CancelSnapshot snapshot = state.reset();
        if (snapshot.loopFuture() != null) {
            snapshot.loopFuture().cancel(true);
        }
        if (snapshot.hadWork()) {
            log.info("Cancelled processing for conversation {}", conversationId);
            audit(conversationId);
        }
        return snapshot.hadWork();
    }

    public boolean isProcessing(String conversationId) {
        ConversationState state = states.get(conversationId);
        return state != null && state.isProcessing();
    }

    public boolean isDebouncing(String conversationId) {
        ConversationState state = states.get(conversationId);
        return state != null && state.isDebouncing();
    }

    public int pendingCount(String conversationId) {
        ConversationState state = states.get(conversationId);
        return state == null ? 0 : state.pendingCount();
    }

    public List<String> activeConversations() {
        List<String> out = new ArrayList<>();
        for (ConversationState state : states.values()) {
            if (state.isLoopActive()) {
                out.add(state.conversationId());
            }
        }
        out.sort(String::compareTo);
        return out;
    }

    @Override
    public void close() {
        for (String conversationId : List.copyOf(states.keySet())) {
            cancel(conversationId);
        }
        loops.shutdownNow();
        try {
            if (!loops.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Conversation loops did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void sendNotice(String conversationId, String text) {
        try {
            noticeSink.send(conversationId, text);
        } catch (RuntimeException e) {
            log.warn("Failed to send notice to conversation {}", conversationId, e);
        }
    }

    private void audit(String conversationId) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.conversation("conversation.cancel", ACTOR, conversationId, "ok", Map.of()));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit row for conversation {}", conversationId, e);
        }
    }
}
