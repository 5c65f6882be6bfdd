package me.go_gradually.voiceinterview.application.shared.async;

import me.go_gradually.voiceinterview.application.support.ManualEventLoop;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeoutsTest {

    private final ManualEventLoop loop = new ManualEventLoop();

    @Test
    void within_returnsValueAndCancelsTimerWhenOperationWins() {
        CompletableFuture<String> operation = new CompletableFuture<>();

        CompletableFuture<String> race = Timeouts.within(() -> operation, Duration.ofSeconds(5), loop,
                () -> new IllegalStateException("late"));
        operation.complete("done");

        assertEquals("done", race.join());
        assertEquals(0, loop.liveTimerCount());
    }

    @Test
    void within_failsWithTimeoutErrorAndIgnoresLateResult() {
        CompletableFuture<String> operation = new CompletableFuture<>();
        CompletableFuture<String> race = Timeouts.within(() -> operation, Duration.ofSeconds(5), loop,
                () -> new IllegalStateException("late"));

        loop.advanceBy(Duration.ofMillis(4999));
        assertFalse(race.isDone());
        loop.advanceBy(Duration.ofMillis(1));
        operation.complete("too late");

        CompletionException error = assertThrows(CompletionException.class, race::join);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("late", error.getCause().getMessage());
    }

    @Test
    void within_convertsSynchronousThrowIntoFailedFuture() {
        CompletableFuture<String> race = Timeouts.within(() -> {
            throw new IllegalArgumentException("boom");
        }, Duration.ofSeconds(5), loop, () -> new IllegalStateException("late"));

        assertTrue(race.isCompletedExceptionally());
        assertEquals("boom", Timeouts.messageOf(assertThrows(CompletionException.class, race::join)));
    }

    @Test
    void delay_completesAfterDuration() {
        CompletableFuture<Void> delayed = Timeouts.delay(loop, Duration.ofSeconds(1));

        loop.advanceBy(Duration.ofMillis(999));
        assertFalse(delayed.isDone());
        loop.advanceBy(Duration.ofMillis(1));
        assertTrue(delayed.isDone());
    }
}
