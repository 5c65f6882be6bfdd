package me.go_gradually.voiceinterview.domain.connection;

import java.time.Duration;

/**
 * Counts connection attempts for one connect request. An attempt is recorded when it starts,
 * so a budget of three allows the first try plus two retries.
 */
public class RetryBudget {
    private final int maxAttempts;
    private final Duration baseDelay;
    private int attempts;

    public RetryBudget(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    public void recordAttempt() {
        attempts++;
    }

    public boolean hasRemaining() {
        return attempts < maxAttempts;
    }

    public Duration nextDelay() {
        return baseDelay.multipliedBy(Math.max(1, attempts));
    }

    public void reset() {
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
