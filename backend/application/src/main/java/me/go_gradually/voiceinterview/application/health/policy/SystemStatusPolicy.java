package me.go_gradually.voiceinterview.application.health.policy;

import java.time.Duration;

public interface SystemStatusPolicy {
    Duration healthCheckTimeout();
}
