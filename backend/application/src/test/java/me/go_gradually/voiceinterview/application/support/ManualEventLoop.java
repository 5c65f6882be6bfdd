package me.go_gradually.voiceinterview.application.support;

import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.ScheduledTask;

import java.time.Duration;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Virtual-clock event loop. Tasks only run inside {@link #advanceBy(Duration)} or {@link #runPending()},
 * on the calling thread.
 */
public class ManualEventLoop implements EventLoop {
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparingLong((Entry entry) -> entry.dueAt).thenComparingLong(entry -> entry.sequence));
    private long nowMillis;
    private long sequence;

    @Override
    public void execute(Runnable task) {
        enqueue(task, nowMillis, 0, new Handle());
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        Handle handle = new Handle();
        enqueue(task, nowMillis + delay.toMillis(), 0, handle);
        return handle;
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        Handle handle = new Handle();
        enqueue(task, nowMillis + initialDelay.toMillis(), period.toMillis(), handle);
        return handle;
    }

    public void runPending() {
        runUntil(nowMillis);
    }

    public void advanceBy(Duration duration) {
        long target = nowMillis + duration.toMillis();
        runUntil(target);
        nowMillis = target;
    }

    public void advanceBySeconds(long seconds) {
        advanceBy(Duration.ofSeconds(seconds));
    }

    public long nowMillis() {
        return nowMillis;
    }

    public long liveTimerCount() {
        return queue.stream().filter(entry -> !entry.handle.cancelled).count();
    }

    private void runUntil(long target) {
        while (true) {
            Entry next = queue.peek();
            if (next == null || next.dueAt > target) {
                return;
            }
            queue.poll();
            if (next.handle.cancelled) {
                continue;
            }
            nowMillis = next.dueAt;
            next.task.run();
            if (next.period > 0 && !next.handle.cancelled) {
                enqueue(next.task, nowMillis + next.period, next.period, next.handle);
            }
        }
    }

    private void enqueue(Runnable task, long dueAt, long period, Handle handle) {
        queue.add(new Entry(task, dueAt, period, sequence++, handle));
    }

    private static final class Entry {
        private final Runnable task;
        private final long dueAt;
        private final long period;
        private final long sequence;
        private final Handle handle;

        private Entry(Runnable task, long dueAt, long period, long sequence, Handle handle) {
            this.task = task;
            this.dueAt = dueAt;
            this.period = period;
            this.sequence = sequence;
            this.handle = handle;
        }
    }

    private static final class Handle implements ScheduledTask {
        private boolean cancelled;

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
