package io.courier.conversation;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class ConversationStateTest {

    @Test
    void idleStateQueuesWithoutSignals() {
        ConversationState state = new ConversationState("chat-1", "user-1");
        AddOutcome outcome = state.addMessage("hello", Map.of());

        Assertions.assertFalse(outcome.interruptedProcessing());
        Assertions.assertFalse(outcome.interruptedDebounce());
        Assertions.assertEquals(1, state.pendingCount());
        Assertions.assertFalse(state.checkInterrupt());
    }

    @Test
    void messageDuringProcessingRaisesInterruptOnce() {
        ConversationState state = new ConversationState("chat-1", "user-1");
        state.setProcessing(true);

        AddOutcome outcome = state.addMessage("wait, one more thing", Map.of());

        Assertions.assertTrue(outcome.interruptedProcessing());
        Assertions.assertFalse(outcome.interruptedDebounce());
        Assertions.assertEquals(1, state.pendingCount());
        Assertions.assertTrue(state.checkInterrupt());
        Assertions.assertFalse(state.checkInterrupt());
    }

    @Test
    void combinedMessageJoinsInOrderAndLaterMetadataWins() {
        ConversationState state = new ConversationState("chat-1", "user-1");
        state.addMessage("first", Map.of("a", 1));
        state.addMessage("second", Map.of("a", 3, "b", 2));

        CombinedMessage combined = state.combinedMessage();

        Assertions.assertEquals("first\nsecond", combined.content());
        Assertions.assertEquals(Map.of("a", 3, "b", 2), combined.metadata());
        Assertions.assertEquals(2, combined.messageCount());
        Assertions.assertEquals(0, state.pendingCount());

        CombinedMessage empty = state.combinedMessage();
        Assertions.assertEquals("", empty.content());
        Assertions.assertTrue(empty.metadata().isEmpty());
        Assertions.assertEquals(0, empty.messageCount());
    }

    @Test
    void messageDuringDebounceRestartsTheQuietWindow() throws Exception {
        ConversationState state = new ConversationState("chat-1", "user-1");
        long generation = state.beginLoop();
        CompletableFuture<Long> waited = CompletableFuture.supplyAsync(() -> {
            long started = System.nanoTime();
            try {
                Assertions.assertTrue(state.awaitQuiet(generation, Duration.ofMillis(300), Duration.ofSeconds(5)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        });

        awaitDebouncing(state);
        Thread.sleep(200L);
        AddOutcome outcome = state.addMessage("still typing", Map.of());
        Assertions.assertTrue(outcome.interruptedDebounce());
        Assertions.assertFalse(outcome.interruptedProcessing());

        long elapsedMs = waited.get(10, TimeUnit.SECONDS);
        Assertions.assertTrue(elapsedMs >= 450L, "debounce ended after " + elapsedMs + "ms");
        Assertions.assertFalse(state.isDebouncing());
    }

    @Test
    void steadyStreamCannotHoldDebouncePastTheCap() throws Exception {
        ConversationState state = new ConversationState("chat-1", "user-1");
        long generation = state.beginLoop();
        CompletableFuture<Long> waited = CompletableFuture.supplyAsync(() -> {
            long started = System.nanoTime();
            try {
                state.awaitQuiet(generation, Duration.ofMillis(200), Duration.ofMillis(600));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        });

        awaitDebouncing(state);
        while (!waited.isDone()) {
            state.addMessage("more", Map.of());
            Thread.sleep(50L);
        }
        long elapsedMs = waited.get(10, TimeUnit.SECONDS);
        Assertions.assertTrue(elapsedMs >= 550L && elapsedMs < 3_000L, "debounce ended after " + elapsedMs + "ms");
    }

    @Test
    void resetDropsEverythingAndEndsTheWait() throws Exception {
        ConversationState state = new ConversationState("chat-1", "user-1");
        long generation = state.beginLoop();
        CompletableFuture<Boolean> waited = CompletableFuture.supplyAsync(() -> {
            try {
                return state.awaitQuiet(generation, Duration.ofSeconds(30), Duration.ofSeconds(60));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return true;
            }
        });
        awaitDebouncing(state);
        state.addMessage("queued", Map.of());

        ConversationState.CancelSnapshot snapshot = state.reset();

        Assertions.assertTrue(snapshot.hadWork());
        Assertions.assertFalse(waited.get(10, TimeUnit.SECONDS));
        Assertions.assertEquals(0, state.pendingCount());
        Assertions.assertFalse(state.isDebouncing());
        Assertions.assertFalse(state.isProcessing());
        Assertions.assertFalse(state.reset().hadWork());
    }

    private static void awaitDebouncing(ConversationState state) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (!state.isDebouncing() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5L);
        }
        Assertions.assertTrue(state.isDebouncing());
    }
}
