package me.go_gradually.voiceinterview.application.connection.model;

import me.go_gradually.voiceinterview.application.connection.port.RealtimeRoom;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One in-flight connect. Tracks the stages still pending so an abandoned attempt
 * cancels its timers and releases a partially constructed room.
 */
public class ConnectionAttempt {
    private final CompletableFuture<RealtimeRoom> outcome = new CompletableFuture<>();
    private final List<CompletableFuture<?>> pendingStages = new CopyOnWriteArrayList<>();
    private volatile RealtimeRoom room;
    private volatile boolean abandoned;

    public <T> CompletableFuture<T> track(CompletableFuture<T> stage) {
        ensureActive();
        pendingStages.add(stage);
        stage.whenComplete((value, error) -> pendingStages.remove(stage));
        return stage;
    }

    public void bindRoom(RealtimeRoom room) {
        if (abandoned) {
            room.disconnect();
            throw new CancellationException("Connection attempt was abandoned");
        }
        this.room = room;
    }

    public RealtimeRoom requireRoom() {
        RealtimeRoom current = room;
        if (current == null) {
            throw new IllegalStateException("Room is not created yet");
        }
        return current;
    }

    public Optional<RealtimeRoom> room() {
        return Optional.ofNullable(room);
    }

    public void ensureActive() {
        if (abandoned) {
            throw new CancellationException("Connection attempt was abandoned");
        }
    }

    public void succeed() {
        outcome.complete(room);
    }

    public void fail(ConnectionFailure failure) {
        outcome.completeExceptionally(failure);
    }

    public CompletableFuture<RealtimeRoom> outcome() {
        return outcome;
    }

    public boolean isAbandoned() {
        return abandoned;
    }

    public void abandon() {
        abandoned = true;
        for (CompletableFuture<?> stage : pendingStages) {
            stage.cancel(false);
        }
        outcome.cancel(false);
        release();
    }

    public void release() {
        RealtimeRoom current = room;
        room = null;
        if (current != null) {
            current.disconnect();
        }
    }
}
