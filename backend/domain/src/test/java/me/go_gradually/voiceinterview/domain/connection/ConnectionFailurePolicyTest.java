package me.go_gradually.voiceinterview.domain.connection;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionFailurePolicyTest {

    @Test
    void decide_retriesRetryableCauseWithLinearBackoff() {
        RetryBudget budget = new RetryBudget(3, Duration.ofSeconds(2));

        budget.recordAttempt();
        ConnectionFailurePolicy.RetryDecision first = ConnectionFailurePolicy.decide(ConnectionFailureCause.TIMEOUT, budget);
        budget.recordAttempt();
        ConnectionFailurePolicy.RetryDecision second = ConnectionFailurePolicy.decide(ConnectionFailureCause.TRANSPORT, budget);
        budget.recordAttempt();
        ConnectionFailurePolicy.RetryDecision third = ConnectionFailurePolicy.decide(ConnectionFailureCause.TIMEOUT, budget);

        assertTrue(first.shouldRetry());
        assertEquals(Duration.ofSeconds(2), first.delay());
        assertTrue(second.shouldRetry());
        assertEquals(Duration.ofSeconds(4), second.delay());
        assertFalse(third.shouldRetry());
    }

    @Test
    void decide_givesUpImmediatelyForNonRetryableCause() {
        RetryBudget budget = new RetryBudget(3, Duration.ofSeconds(2));
        budget.recordAttempt();

        ConnectionFailurePolicy.RetryDecision decision =
                ConnectionFailurePolicy.decide(ConnectionFailureCause.PERMISSION_DENIED, budget);

        assertEquals(ConnectionFailurePolicy.DecisionType.GIVE_UP, decision.type());
    }

    @Test
    void retryBudget_resetClearsAttempts() {
        RetryBudget budget = new RetryBudget(3, Duration.ofSeconds(2));
        budget.recordAttempt();
        budget.recordAttempt();

        budget.reset();

        assertEquals(0, budget.attempts());
        assertTrue(budget.hasRemaining());
    }

    @Test
    void retryableSet_isTimeoutAndTransportOnly() {
        for (ConnectionFailureCause cause : ConnectionFailureCause.values()) {
            boolean expected = cause == ConnectionFailureCause.TIMEOUT || cause == ConnectionFailureCause.TRANSPORT;
            assertEquals(expected, cause.isRetryable(), cause.name());
        }
    }
}
