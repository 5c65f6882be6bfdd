package me.go_gradually.voiceinterview.application.health.port;

import me.go_gradually.voiceinterview.application.health.model.HealthStatus;

import java.util.concurrent.CompletableFuture;

public interface HealthPort {
    CompletableFuture<HealthStatus> check();
}
