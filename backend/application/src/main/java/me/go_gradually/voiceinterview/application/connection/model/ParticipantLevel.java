package me.go_gradually.voiceinterview.application.connection.model;

public record ParticipantLevel(String identity, double level) {
}
