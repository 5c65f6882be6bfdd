package me.go_gradually.voiceinterview.application.health.model;

public record HealthStatus(boolean healthy, boolean realtimeConfigured, String detail) {
}
