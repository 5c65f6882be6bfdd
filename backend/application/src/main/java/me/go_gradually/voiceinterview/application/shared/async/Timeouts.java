package me.go_gradually.voiceinterview.application.shared.async;

import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.ScheduledTask;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

public final class Timeouts {
    private Timeouts() {
    }

    /**
     * Races {@code operation} against a timer on {@code loop}. Whichever settles first wins;
     * the loser's result is ignored. Cancelling the returned future also cancels the timer.
     */
    public static <T> CompletableFuture<T> within(Supplier<? extends CompletableFuture<T>> operation,
                                                  Duration timeout,
                                                  EventLoop loop,
                                                  Supplier<? extends RuntimeException> onTimeout) {
        CompletableFuture<T> race = new CompletableFuture<>();
        ScheduledTask timer = loop.schedule(() -> race.completeExceptionally(onTimeout.get()), timeout);
        race.whenComplete((value, error) -> timer.cancel());
        invoke(operation).whenComplete((value, error) -> {
            if (error != null) {
                race.completeExceptionally(unwrap(error));
            } else {
                race.complete(value);
            }
        });
        return race;
    }

    public static CompletableFuture<Void> delay(EventLoop loop, Duration delay) {
        CompletableFuture<Void> delayed = new CompletableFuture<>();
        ScheduledTask timer = loop.schedule(() -> delayed.complete(null), delay);
        delayed.whenComplete((value, error) -> timer.cancel());
        return delayed;
    }

    public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Operation returned no result"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String messageOf(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
