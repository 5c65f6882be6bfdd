package me.go_gradually.voiceinterview.application.connection.policy;

import java.time.Duration;

public interface ConnectionPolicy {
    Duration microphoneProbeTimeout();

    Duration connectTimeout();

    Duration publishTimeout();

    Duration trackVerificationDelay();

    int maxConnectionAttempts();

    Duration retryBaseDelay();

    Duration audioSampleInterval();

    Duration disconnectResultsDelay();
}
