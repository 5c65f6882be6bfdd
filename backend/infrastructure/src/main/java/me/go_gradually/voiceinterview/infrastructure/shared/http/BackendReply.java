package me.go_gradually.voiceinterview.infrastructure.shared.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Status code and parsed JSON body of one backend call. Non-2xx responses are values, not errors;
 * only transport failures complete the future exceptionally.
 */
public record BackendReply(int status, JsonNode body) {
    private static final Logger log = Logger.getLogger(BackendReply.class.getName());

    public static CompletableFuture<BackendReply> exchange(WebClient.RequestHeadersSpec<?> request, ObjectMapper objectMapper) {
        return request.exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new BackendReply(response.statusCode().value(), parse(objectMapper, text))))
                .toFuture();
    }

    static JsonNode parse(ObjectMapper objectMapper, String text) {
        if (text == null || text.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warning("backend.reply malformed_json reason=" + e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    public boolean isOk() {
        return status >= 200 && status < 300;
    }

    /**
     * 2xx with {@code success: true}.
     */
    public boolean succeeded() {
        return isOk() && body.path("success").asBoolean(false);
    }

    public String errorMessage() {
        String error = body.path("error").asText("");
        if (error.isBlank()) {
            error = body.path("message").asText("");
        }
        if (!error.isBlank()) {
            return error;
        }
        return isOk() ? "Request was not successful" : "HTTP " + status;
    }

    public String text(String field) {
        return body.path(field).asText("");
    }
}
