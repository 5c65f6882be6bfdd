package me.go_gradually.voiceinterview.infrastructure.setup.backend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voiceinterview.application.setup.model.AnalysisResult;
import me.go_gradually.voiceinterview.application.setup.model.QuestionsResult;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationCommand;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationResult;
import me.go_gradually.voiceinterview.application.setup.model.UploadResult;
import me.go_gradually.voiceinterview.application.setup.port.InterviewSetupPort;
import me.go_gradually.voiceinterview.domain.form.Attachment;
import me.go_gradually.voiceinterview.domain.form.AttachmentSlot;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.session.SessionId;
import me.go_gradually.voiceinterview.infrastructure.shared.http.BackendReply;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

@Component
public class WebClientInterviewSetupAdapter implements InterviewSetupPort {
    private static final Logger log = Logger.getLogger(WebClientInterviewSetupAdapter.class.getName());
    private static final TypeReference<Map<String, Object>> ANALYSIS_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebClientInterviewSetupAdapter(@Qualifier("backendWebClient") WebClient webClient, Clock clock) {
        this.webClient = webClient;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<UploadResult> upload(Attachment jobDescription, Attachment resume) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        addFilePart(builder, AttachmentSlot.JOB_DESCRIPTION, jobDescription);
        addFilePart(builder, AttachmentSlot.RESUME, resume);
        WebClient.RequestHeadersSpec<?> request = webClient.post()
                .uri("/api/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()));
        return BackendReply.exchange(request, objectMapper).thenApply(reply -> {
            if (!reply.succeeded()) {
                return UploadResult.failed(reply.errorMessage());
            }
            return UploadResult.succeeded(reply.text("jd_full"), reply.text("resume_full"));
        });
    }

    @Override
    public CompletableFuture<AnalysisResult> analyze(String jobDescriptionText, String resumeText) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jd_text", jobDescriptionText);
        payload.put("resume_text", resumeText);
        return postJson("/api/analyze", payload).thenApply(reply -> {
            if (!reply.succeeded()) {
                return AnalysisResult.failed(reply.errorMessage());
            }
            JsonNode analysis = reply.body().path("analysis");
            Map<String, Object> values = analysis.isObject()
                    ? objectMapper.convertValue(analysis, ANALYSIS_TYPE)
                    : Map.of();
            return AnalysisResult.succeeded(values);
        });
    }

    @Override
    public CompletableFuture<QuestionsResult> generateQuestions(String jobDescriptionText, String resumeText, int count) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jd_text", jobDescriptionText);
        payload.put("resume_text", resumeText);
        payload.put("num_questions", count);
        return postJson("/api/generate-questions", payload).thenApply(reply -> {
            if (!reply.succeeded()) {
                return QuestionsResult.failed(reply.errorMessage());
            }
            List<String> questions = new ArrayList<>();
            for (JsonNode question : reply.body().path("questions")) {
                String text = question.asText("");
                if (!text.isBlank()) {
                    questions.add(text);
                }
            }
            if (questions.isEmpty()) {
                return QuestionsResult.failed("No questions were generated");
            }
            return QuestionsResult.succeeded(questions);
        });
    }

    @Override
    public CompletableFuture<SessionCreationResult> createSession(SessionCreationCommand command) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("candidate_name", command.candidateName());
        payload.put("position", command.position());
        payload.put("email", command.email());
        payload.put("questions", command.questions());
        payload.put("analysis", command.analysis());
        payload.put("jd_full", command.jobDescriptionText());
        payload.put("resume_full", command.resumeText());
        return postJson("/api/create-session", payload).thenApply(reply -> {
            if (!reply.succeeded()) {
                return SessionCreationResult.failed(reply.errorMessage());
            }
            JsonNode data = reply.body().path("data");
            String sessionId = data.path("session_id").asText("");
            if (sessionId.isBlank()) {
                return SessionCreationResult.failed("Session id is missing from session data");
            }
            SessionDescriptor descriptor = new SessionDescriptor(
                    SessionId.of(sessionId),
                    command.candidateName(),
                    command.questions(),
                    data.path("livekit_url").asText(""),
                    data.path("candidate_token").asText(""),
                    data.path("room_name").asText(""),
                    clock.instant());
            log.info(() -> "setup.session created session=" + sessionId + " room=" + descriptor.roomName());
            return SessionCreationResult.succeeded(descriptor);
        });
    }

    private CompletableFuture<BackendReply> postJson(String path, Map<String, Object> payload) {
        return BackendReply.exchange(webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload), objectMapper);
    }

    private void addFilePart(MultipartBodyBuilder builder, AttachmentSlot slot, Attachment attachment) {
        builder.part(slot.partName(), attachment.content())
                .filename(attachment.fileName())
                .contentType(MediaType.parseMediaType(attachment.contentType()));
    }
}
