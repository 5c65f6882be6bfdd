package me.go_gradually.voiceinterview.infrastructure.setup.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voiceinterview.application.setup.model.AnalysisResult;
import me.go_gradually.voiceinterview.application.setup.model.QuestionsResult;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationCommand;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationResult;
import me.go_gradually.voiceinterview.application.setup.model.UploadResult;
import me.go_gradually.voiceinterview.domain.form.Attachment;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.infrastructure.support.TestWebClients;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebClientInterviewSetupAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Instant now = Instant.parse("2026-03-01T10:00:00Z");

    private MockWebServer server;
    private WebClientInterviewSetupAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = new WebClientInterviewSetupAdapter(TestWebClients.backend(server), Clock.fixed(now, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void upload_sendsBothFilesAsMultipartParts() throws Exception {
        server.enqueue(json(200, """
                {"success": true, "jd_full": "jd text", "resume_full": "resume text"}
                """));

        UploadResult result = adapter.upload(
                Attachment.of("jd.pdf", "application/pdf", "JD".getBytes(StandardCharsets.UTF_8)),
                Attachment.of("cv.docx", "application/octet-stream", "CV".getBytes(StandardCharsets.UTF_8))).join();

        assertTrue(result.success());
        assertEquals("jd text", result.jobDescriptionText());
        assertEquals("resume text", result.resumeText());
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/api/upload", request.getPath());
        assertTrue(request.getHeader("Content-Type").startsWith("multipart/form-data"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("name=\"jd_file\"; filename=\"jd.pdf\""));
        assertTrue(body.contains("name=\"resume_file\"; filename=\"cv.docx\""));
    }

    @Test
    void upload_surfacesServerErrorMessageOnNon2xx() {
        server.enqueue(json(413, """
                {"error": "File too large"}
                """));

        UploadResult result = adapter.upload(Attachment.of("a.txt", "text/plain", new byte[]{1}),
                Attachment.of("b.txt", "text/plain", new byte[]{2})).join();

        assertFalse(result.success());
        assertEquals("File too large", result.error());
    }

    @Test
    void analyze_postsTextsAndReturnsAnalysisMap() throws Exception {
        server.enqueue(json(200, """
                {"success": true, "analysis": {"fit": "strong", "score": 8}}
                """));

        AnalysisResult result = adapter.analyze("jd text", "resume text").join();

        assertTrue(result.success());
        assertEquals("strong", result.analysis().get("fit"));
        assertEquals(8, result.analysis().get("score"));
        JsonNode payload = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("jd text", payload.path("jd_text").asText());
        assertEquals("resume text", payload.path("resume_text").asText());
    }

    @Test
    void analyze_reportsExplicitFailureFlag() {
        server.enqueue(json(200, """
                {"success": false, "error": "Analysis service unavailable"}
                """));

        AnalysisResult result = adapter.analyze("jd", "resume").join();

        assertFalse(result.success());
        assertEquals("Analysis service unavailable", result.error());
    }

    @Test
    void generateQuestions_sendsRequestedCount() throws Exception {
        server.enqueue(json(200, """
                {"success": true, "questions": ["Tell me about yourself", "Why Java?"]}
                """));

        QuestionsResult result = adapter.generateQuestions("jd", "resume", 6).join();

        assertEquals(List.of("Tell me about yourself", "Why Java?"), result.questions());
        RecordedRequest request = server.takeRequest();
        assertEquals("/api/generate-questions", request.getPath());
        assertEquals(6, objectMapper.readTree(request.getBody().readUtf8()).path("num_questions").asInt());
    }

    @Test
    void generateQuestions_reportsHttpStatusWhenBodyHasNoError() {
        server.enqueue(new MockResponse().setResponseCode(502));

        QuestionsResult result = adapter.generateQuestions("jd", "resume", 6).join();

        assertFalse(result.success());
        assertEquals("HTTP 502", result.error());
    }

    @Test
    void createSession_buildsDescriptorFromSessionData() throws Exception {
        server.enqueue(json(200, """
                {"success": true, "data": {"session_id": "abc123def456", "room_name": "interview-abc",
                 "candidate_token": "tok", "livekit_url": "wss://rt.example.com"}}
                """));
        SessionCreationCommand command = new SessionCreationCommand("Jane Doe", "Backend Engineer", "jane@example.com",
                List.of("q1", "q2"), Map.of("fit", "strong"), "jd text", "resume text");

        SessionCreationResult result = adapter.createSession(command).join();

        assertTrue(result.success());
        SessionDescriptor descriptor = result.descriptor();
        assertEquals("abc123def456", descriptor.sessionId().value());
        assertEquals("wss://rt.example.com", descriptor.transportUrl());
        assertEquals("tok", descriptor.token());
        assertEquals("interview-abc", descriptor.roomName());
        assertEquals(List.of("q1", "q2"), descriptor.questions());
        assertEquals(now, descriptor.createdAt());
        JsonNode payload = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("Jane Doe", payload.path("candidate_name").asText());
        assertEquals("jd text", payload.path("jd_full").asText());
        assertEquals("strong", payload.path("analysis").path("fit").asText());
    }

    @Test
    void createSession_failsWithoutSessionId() {
        server.enqueue(json(200, """
                {"success": true, "data": {}}
                """));
        SessionCreationCommand command = new SessionCreationCommand("Jane", "Dev", "j@e.com",
                List.of("q1"), Map.of(), "jd", "cv");

        SessionCreationResult result = adapter.createSession(command).join();

        assertFalse(result.success());
    }

    @Test
    void analyze_completesExceptionallyWhenBackendIsUnreachable() throws Exception {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        WebClientInterviewSetupAdapter unreachable = new WebClientInterviewSetupAdapter(
                TestWebClients.backend(stopped), Clock.fixed(now, ZoneOffset.UTC));
        stopped.shutdown();

        assertThrows(CompletionException.class, () -> unreachable.analyze("jd", "resume").join());
    }

    private MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
