package me.go_gradually.voiceinterview.application.connection.model;

import me.go_gradually.voiceinterview.domain.connection.ConnectionState;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.session.SessionStatus;

import java.util.Optional;

public record InterviewSnapshot(ConnectionState state,
                                SessionDescriptor descriptor,
                                SessionStatus sessionStatus,
                                int connectionAttempts,
                                boolean reconciling,
                                long generation) {
    public Optional<SessionDescriptor> currentDescriptor() {
        return Optional.ofNullable(descriptor);
    }
}
