package me.go_gradually.voiceinterview.application.session.port;

import me.go_gradually.voiceinterview.domain.session.SessionId;
import me.go_gradually.voiceinterview.domain.session.SessionStatus;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

public interface SessionStatusPort {
    CompletableFuture<Void> updateStatus(SessionId sessionId, SessionStatus status, Instant changedAt);

    CompletableFuture<SessionStatus> fetchStatus(SessionId sessionId);
}
