package me.go_gradually.voiceinterview.domain.connection;

import java.time.Duration;

public final class ConnectionFailurePolicy {
    private ConnectionFailurePolicy() {
    }

    public static RetryDecision decide(ConnectionFailureCause cause, RetryBudget budget) {
        if (cause == null) {
            throw new IllegalArgumentException("Failure cause is required");
        }
        if (budget == null) {
            throw new IllegalArgumentException("Retry budget is required");
        }
        if (cause.isRetryable() && budget.hasRemaining()) {
            return RetryDecision.retry(budget.nextDelay());
        }
        return RetryDecision.giveUp();
    }

    public record RetryDecision(DecisionType type, Duration delay) {
        public static RetryDecision retry(Duration delay) {
            if (delay == null) {
                throw new IllegalArgumentException("Retry delay is required");
            }
            return new RetryDecision(DecisionType.RETRY, delay);
        }

        public static RetryDecision giveUp() {
            return new RetryDecision(DecisionType.GIVE_UP, null);
        }

        public boolean shouldRetry() {
            return type == DecisionType.RETRY;
        }
    }

    public enum DecisionType {
        RETRY,
        GIVE_UP
    }
}
