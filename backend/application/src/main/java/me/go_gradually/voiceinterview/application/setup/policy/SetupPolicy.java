package me.go_gradually.voiceinterview.application.setup.policy;

import me.go_gradually.voiceinterview.domain.setup.SetupStep;

import java.time.Duration;

public interface SetupPolicy {
    Duration stepTimeout(SetupStep step);

    int questionCount();

    Duration autoConnectDelay();
}
