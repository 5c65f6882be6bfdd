package me.go_gradually.voiceinterview.application.setup.model;

import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;

public record SessionCreationResult(boolean success, SessionDescriptor descriptor, String error) implements StepResult {
    public static SessionCreationResult succeeded(SessionDescriptor descriptor) {
        return new SessionCreationResult(true, descriptor, null);
    }

    public static SessionCreationResult failed(String error) {
        return new SessionCreationResult(false, null, error);
    }
}
