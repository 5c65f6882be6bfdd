package me.go_gradually.voiceinterview.domain.status;

import java.time.Duration;

public class PollCycle {
    private final int maxAttempts;
    private final Duration interval;
    private int attempts;

    public PollCycle(int maxAttempts, Duration interval) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.interval = interval;
    }

    /**
     * @return true once the ceiling has been reached
     */
    public boolean recordAttempt() {
        attempts++;
        return isExhausted();
    }

    public boolean isExhausted() {
        return attempts >= maxAttempts;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration interval() {
        return interval;
    }
}
