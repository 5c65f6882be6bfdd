package me.go_gradually.voiceinterview.infrastructure.health.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voiceinterview.application.health.model.HealthStatus;
import me.go_gradually.voiceinterview.application.health.port.HealthPort;
import me.go_gradually.voiceinterview.infrastructure.shared.http.BackendReply;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.CompletableFuture;

@Component
public class WebClientHealthAdapter implements HealthPort {
    private static final String HEALTHY = "healthy";

    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebClientHealthAdapter(@Qualifier("backendWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public CompletableFuture<HealthStatus> check() {
        return BackendReply.exchange(webClient.get().uri("/api/health"), objectMapper).thenApply(reply -> {
            if (!reply.isOk()) {
                return new HealthStatus(false, false, "HTTP " + reply.status());
            }
            String status = reply.text("status");
            boolean realtime = reply.body().path("livekit_connected").asBoolean(false);
            return new HealthStatus(HEALTHY.equalsIgnoreCase(status), realtime, status);
        });
    }
}
