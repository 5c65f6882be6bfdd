package me.go_gradually.voiceinterview.infrastructure.report.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voiceinterview.application.report.model.ReportDispatchResult;
import me.go_gradually.voiceinterview.application.report.port.ReportPort;
import me.go_gradually.voiceinterview.domain.report.ReportDocument;
import me.go_gradually.voiceinterview.domain.session.SessionId;
import me.go_gradually.voiceinterview.infrastructure.shared.http.BackendReply;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

@Component
public class WebClientReportAdapter implements ReportPort {
    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebClientReportAdapter(@Qualifier("backendWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public CompletableFuture<ReportDispatchResult> sendReport(SessionId sessionId) {
        WebClient.RequestHeadersSpec<?> request = webClient.post()
                .uri("/api/reports/{id}/send", sessionId.value())
                .contentType(MediaType.APPLICATION_JSON);
        return BackendReply.exchange(request, objectMapper).thenApply(reply -> reply.succeeded()
                ? new ReportDispatchResult(true, reply.text("message"))
                : new ReportDispatchResult(false, reply.errorMessage()));
    }

    @Override
    public CompletableFuture<ReportDocument> downloadReport(SessionId sessionId) {
        return webClient.get()
                .uri("/api/reports/{id}", sessionId.value())
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return Mono.error(new IllegalStateException("HTTP " + response.statusCode().value()));
                    }
                    String contentType = response.headers().contentType()
                            .map(MediaType::toString)
                            .orElse(MediaType.APPLICATION_PDF_VALUE);
                    return response.bodyToMono(byte[].class)
                            .defaultIfEmpty(new byte[0])
                            .map(bytes -> ReportDocument.forSession(sessionId, contentType, bytes));
                })
                .toFuture();
    }
}
