package me.go_gradually.voiceinterview.application.shared.port;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Single logical thread that owns all interview orchestration state.
 * Collaborator completions are marshalled back here through {@link #asExecutor()}.
 */
public interface EventLoop {
    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    default Executor asExecutor() {
        return this::execute;
    }
}
