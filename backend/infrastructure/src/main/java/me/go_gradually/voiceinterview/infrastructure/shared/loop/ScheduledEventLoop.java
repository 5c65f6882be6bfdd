package me.go_gradually.voiceinterview.infrastructure.shared.loop;

import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.ScheduledTask;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventLoop} over a single-threaded scheduler. A task that throws is logged and the loop keeps running;
 * a periodic task keeps its schedule.
 */
public class ScheduledEventLoop implements EventLoop {
    private static final Logger log = Logger.getLogger(ScheduledEventLoop.class.getName());

    private final ScheduledExecutorService scheduler;

    public ScheduledEventLoop(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void execute(Runnable task) {
        scheduler.execute(guarded(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        long millis = Math.max(0, delay.toMillis());
        return new FutureTask(scheduler.schedule(guarded(task), millis, TimeUnit.MILLISECONDS));
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        return new FutureTask(scheduler.scheduleAtFixedRate(guarded(task),
                Math.max(0, initialDelay.toMillis()), period.toMillis(), TimeUnit.MILLISECONDS));
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.log(Level.SEVERE, "event_loop.task failure reason=" + e.getMessage(), e);
            }
        };
    }

    private static final class FutureTask implements ScheduledTask {
        private final ScheduledFuture<?> future;

        private FutureTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
