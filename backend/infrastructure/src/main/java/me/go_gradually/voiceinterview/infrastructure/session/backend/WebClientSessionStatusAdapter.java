package me.go_gradually.voiceinterview.infrastructure.session.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voiceinterview.application.session.port.SessionStatusPort;
import me.go_gradually.voiceinterview.domain.session.SessionId;
import me.go_gradually.voiceinterview.domain.session.SessionStatus;
import me.go_gradually.voiceinterview.infrastructure.shared.http.BackendReply;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class WebClientSessionStatusAdapter implements SessionStatusPort {
    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebClientSessionStatusAdapter(@Qualifier("backendWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public CompletableFuture<Void> updateStatus(SessionId sessionId, SessionStatus status, Instant changedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status.code());
        payload.put(status.isLive() ? "connected_at" : "updated_at", changedAt.toString());
        WebClient.RequestHeadersSpec<?> request = webClient.put()
                .uri("/api/session/{id}", sessionId.value())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload);
        return BackendReply.exchange(request, objectMapper).thenAccept(reply -> {
            if (!reply.isOk()) {
                throw new IllegalStateException("Session status update failed: " + reply.errorMessage());
            }
        });
    }

    @Override
    public CompletableFuture<SessionStatus> fetchStatus(SessionId sessionId) {
        return BackendReply.exchange(webClient.get().uri("/api/session/{id}", sessionId.value()), objectMapper)
                .thenApply(reply -> {
                    if (!reply.isOk()) {
                        throw new IllegalStateException("HTTP " + reply.status());
                    }
                    if (!reply.succeeded()) {
                        throw new IllegalStateException("Session lookup failed: " + reply.errorMessage());
                    }
                    return SessionStatus.fromCode(statusOf(reply.body()));
                });
    }

    private String statusOf(JsonNode body) {
        JsonNode session = body.path("session");
        if (session.isMissingNode() || session.isNull()) {
            session = body.path("data").path("session");
        }
        return session.path("status").asText("");
    }
}
