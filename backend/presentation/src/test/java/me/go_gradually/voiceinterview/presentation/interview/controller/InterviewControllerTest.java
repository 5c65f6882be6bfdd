package me.go_gradually.voiceinterview.presentation.interview.controller;

import me.go_gradually.voiceinterview.application.connection.model.InterviewSnapshot;
import me.go_gradually.voiceinterview.application.console.usecase.InterviewConsoleUseCase;
import me.go_gradually.voiceinterview.application.setup.model.SetupStepException;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.domain.connection.ConnectionState;
import me.go_gradually.voiceinterview.domain.form.Attachment;
import me.go_gradually.voiceinterview.domain.form.AttachmentSlot;
import me.go_gradually.voiceinterview.domain.report.ReportDocument;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.session.SessionId;
import me.go_gradually.voiceinterview.domain.session.SessionStatus;
import me.go_gradually.voiceinterview.domain.setup.SetupStep;
import me.go_gradually.voiceinterview.presentation.TestBootApplication;
import me.go_gradually.voiceinterview.presentation.shared.error.ApiExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = {TestBootApplication.class, InterviewController.class, ApiExceptionHandler.class})
@AutoConfigureMockMvc
class InterviewControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InterviewConsoleUseCase consoleUseCase;

    @Test
    void updateForm_forwardsFieldsToConsole() throws Exception {
        mockMvc.perform(put("/api/interview/form")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "candidateName":"Ada Lovelace",
                                  "position":"Backend Engineer",
                                  "email":"ada@example.com"
                                }
                                """))
                .andExpect(status().isAccepted());

        verify(consoleUseCase).updateForm("Ada Lovelace", "Backend Engineer", "ada@example.com");
    }

    @Test
    void attach_returnsWhetherAttachmentWasAccepted() throws Exception {
        when(consoleUseCase.attach(eq(AttachmentSlot.RESUME), any())).thenReturn(CompletableFuture.completedFuture(true));
        MockMultipartFile file = new MockMultipartFile("file", "resume.pdf", "application/pdf", new byte[]{1, 2, 3});

        MvcResult result = mockMvc.perform(multipart("/api/interview/attachments/resume").file(file))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slot").value("resume_file"))
                .andExpect(jsonPath("$.fileName").value("resume.pdf"))
                .andExpect(jsonPath("$.sizeBytes").value(3))
                .andExpect(jsonPath("$.accepted").value(true));
        ArgumentCaptor<Attachment> captor = ArgumentCaptor.forClass(Attachment.class);
        verify(consoleUseCase).attach(eq(AttachmentSlot.RESUME), captor.capture());
        assertEquals("application/pdf", captor.getValue().contentType());
    }

    @Test
    void attach_returnsBadRequest_whenSlotUnknown() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "cover.pdf", "application/pdf", new byte[]{1});

        mockMvc.perform(multipart("/api/interview/attachments/cover-letter").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown attachment slot: cover-letter"));

        verify(consoleUseCase, never()).attach(any(), any());
    }

    @Test
    void detach_acceptsJobDescriptionSlot() throws Exception {
        mockMvc.perform(delete("/api/interview/attachments/job-description"))
                .andExpect(status().isAccepted());

        verify(consoleUseCase).detach(AttachmentSlot.JOB_DESCRIPTION);
    }

    @Test
    void setup_returnsCreatedSession() throws Exception {
        SessionDescriptor descriptor = new SessionDescriptor(SessionId.of("session-1"), "Ada", List.of("Q1", "Q2"),
                "wss://rtc.example.com", "token", "room-1", Instant.parse("2026-01-01T00:00:00Z"));
        when(consoleUseCase.startSetup()).thenReturn(CompletableFuture.completedFuture(descriptor));

        MvcResult result = mockMvc.perform(post("/api/interview/setup"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("session-1"))
                .andExpect(jsonPath("$.roomName").value("room-1"))
                .andExpect(jsonPath("$.questions.length()").value(2));
    }

    @Test
    void setup_returnsBadGateway_whenStepFails() throws Exception {
        when(consoleUseCase.startSetup()).thenReturn(CompletableFuture.failedFuture(
                new SetupStepException(SetupStep.ANALYZE, "Document analysis failed", false)));

        MvcResult result = mockMvc.perform(post("/api/interview/setup"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("SETUP_STEP_FAILED"))
                .andExpect(jsonPath("$.step").value("analyze"))
                .andExpect(jsonPath("$.message").value("Document analysis failed"));
    }

    @Test
    void connectDisconnectAndReset_areAccepted() throws Exception {
        mockMvc.perform(post("/api/interview/connect")).andExpect(status().isAccepted());
        mockMvc.perform(post("/api/interview/disconnect")).andExpect(status().isAccepted());
        mockMvc.perform(post("/api/interview/reset")).andExpect(status().isAccepted());

        verify(consoleUseCase).connect();
        verify(consoleUseCase).disconnect();
        verify(consoleUseCase).startNewInterview();
    }

    @Test
    void systemStatus_returnsLevelCode() throws Exception {
        when(consoleUseCase.checkSystemStatus()).thenReturn(CompletableFuture.completedFuture(MessageLevel.WARNING));

        MvcResult result = mockMvc.perform(post("/api/interview/system-status"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value("warning"));
    }

    @Test
    void state_returnsConnectionSnapshot() throws Exception {
        SessionDescriptor descriptor = new SessionDescriptor(SessionId.of("session-1"), "Ada", List.of("Q1"),
                "wss://rtc.example.com", "token", "room-1", Instant.parse("2026-01-01T00:00:00Z"));
        when(consoleUseCase.snapshot()).thenReturn(CompletableFuture.completedFuture(
                new InterviewSnapshot(ConnectionState.CONNECTED, descriptor, SessionStatus.LIVE, 1, true, 2L)));
        when(consoleUseCase.latestReport()).thenReturn(Optional.empty());

        MvcResult result = mockMvc.perform(get("/api/interview/state"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connectionState").value("connected"))
                .andExpect(jsonPath("$.sessionId").value("session-1"))
                .andExpect(jsonPath("$.sessionStatus").value("in-progress"))
                .andExpect(jsonPath("$.connectionAttempts").value(1))
                .andExpect(jsonPath("$.reconciling").value(true))
                .andExpect(jsonPath("$.reportAvailable").value(false));
    }

    @Test
    void report_returnsArchivedDocumentAsAttachment() throws Exception {
        ReportDocument document = new ReportDocument("interview_report_session1.pdf", "application/pdf", new byte[]{37, 80, 68, 70});
        when(consoleUseCase.latestReport()).thenReturn(Optional.of(document));

        MvcResult result = mockMvc.perform(get("/api/interview/report"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"interview_report_session1.pdf\""))
                .andExpect(content().contentType("application/pdf"))
                .andExpect(content().bytes(new byte[]{37, 80, 68, 70}));
        verify(consoleUseCase, never()).downloadReport();
    }

    @Test
    void report_returnsNotFound_whenNoSessionExists() throws Exception {
        when(consoleUseCase.latestReport()).thenReturn(Optional.empty());
        when(consoleUseCase.downloadReport()).thenReturn(CompletableFuture.failedFuture(
                new NoSuchElementException("No interview session to download a report for")));

        MvcResult result = mockMvc.perform(get("/api/interview/report"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No interview session to download a report for"));
    }

    @Test
    void events_subscribesSinkToConsole() throws Exception {
        mockMvc.perform(get("/api/interview/events"))
                .andExpect(status().isOk());

        verify(consoleUseCase).subscribe(any());
    }
}
