package me.go_gradually.voiceinterview.application.status.policy;

import java.time.Duration;

public interface StatusPollPolicy {
    Duration pollInterval();

    int maxPollAttempts();

    Duration pollRequestTimeout();
}
