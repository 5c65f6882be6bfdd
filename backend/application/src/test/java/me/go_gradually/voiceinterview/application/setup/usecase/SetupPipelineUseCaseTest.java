package me.go_gradually.voiceinterview.application.setup.usecase;

import me.go_gradually.voiceinterview.application.connection.usecase.ConnectionSupervisor;
import me.go_gradually.voiceinterview.application.form.usecase.FormGateUseCase;
import me.go_gradually.voiceinterview.application.setup.model.AnalysisResult;
import me.go_gradually.voiceinterview.application.setup.model.QuestionsResult;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationCommand;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationResult;
import me.go_gradually.voiceinterview.application.setup.model.UploadResult;
import me.go_gradually.voiceinterview.application.setup.port.InterviewSetupPort;
import me.go_gradually.voiceinterview.application.shared.port.MetricsPort;
import me.go_gradually.voiceinterview.application.support.FixedPolicies;
import me.go_gradually.voiceinterview.application.support.Fixtures;
import me.go_gradually.voiceinterview.application.support.ManualEventLoop;
import me.go_gradually.voiceinterview.application.support.RecordingEventSink;
import me.go_gradually.voiceinterview.application.view.model.ViewEvents;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;
import me.go_gradually.voiceinterview.domain.form.AttachmentSlot;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.setup.SetupStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SetupPipelineUseCaseTest {

    @Mock
    private InterviewSetupPort setupPort;
    @Mock
    private ConnectionSupervisor supervisor;
    @Mock
    private MetricsPort metrics;

    private ManualEventLoop loop;
    private RecordingEventSink sink;
    private FormGateUseCase formGate;
    private SetupPipelineUseCase pipeline;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        InterviewView view = new InterviewView();
        sink = new RecordingEventSink();
        view.register(sink);
        FixedPolicies policies = new FixedPolicies();
        formGate = new FormGateUseCase(policies, loop, view);
        pipeline = new SetupPipelineUseCase(setupPort, formGate, supervisor, policies, loop, view, metrics);
        lenient().when(supervisor.acceptsNewSession()).thenReturn(true);
    }

    @Test
    void start_runsAllStepsInOrderAndHandsDescriptorToSupervisor() {
        fillValidForm();
        SessionDescriptor descriptor = Fixtures.descriptor();
        stubUploadAndAnalyze();
        when(setupPort.generateQuestions("jd text", "resume text", 6))
                .thenReturn(completedFuture(QuestionsResult.succeeded(descriptor.questions())));
        when(setupPort.createSession(any())).thenReturn(completedFuture(SessionCreationResult.succeeded(descriptor)));

        CompletableFuture<SessionDescriptor> result = pipeline.start();
        loop.runPending();

        assertSame(descriptor, result.join());
        verify(supervisor).attach(descriptor);
        verify(supervisor).scheduleConnect(Duration.ofSeconds(1));
        List<Object> percents = sink.payloads(ViewEvents.SETUP_PROGRESS).stream().map(p -> p.get("percent")).toList();
        assertEquals(List.of(10, 30, 60, 80, 100), percents);
        assertEquals(List.of("processing", "voice"), sink.sections());
        Map<String, Object> progress = sink.payloads(ViewEvents.INTERVIEW_PROGRESS).get(0);
        assertEquals(0, progress.get("current"));
        assertEquals(6, progress.get("total"));
        assertFalse(pipeline.isRunning());
    }

    @Test
    void start_passesCollectedDataToSessionCreation() {
        fillValidForm();
        stubUploadAndAnalyze();
        when(setupPort.generateQuestions(anyString(), anyString(), anyInt()))
                .thenReturn(completedFuture(QuestionsResult.succeeded(List.of("q1"))));
        when(setupPort.createSession(any())).thenReturn(completedFuture(SessionCreationResult.succeeded(Fixtures.descriptor())));

        pipeline.start();
        loop.runPending();

        ArgumentCaptor<SessionCreationCommand> captor = ArgumentCaptor.forClass(SessionCreationCommand.class);
        verify(setupPort).createSession(captor.capture());
        SessionCreationCommand command = captor.getValue();
        assertEquals("Jane Doe", command.candidateName());
        assertEquals("jane@example.com", command.email());
        assertEquals(List.of("q1"), command.questions());
        assertEquals(Map.of("fit", "strong"), command.analysis());
        assertEquals("jd text", command.jobDescriptionText());
    }

    @Test
    void start_stopsAtFailedStepAndNeverInvokesLaterSteps() {
        fillValidForm();
        when(setupPort.upload(any(), any()))
                .thenReturn(completedFuture(UploadResult.succeeded("jd text", "resume text")));
        when(setupPort.analyze("jd text", "resume text"))
                .thenReturn(completedFuture(AnalysisResult.failed("Analysis service unavailable")));

        CompletableFuture<SessionDescriptor> result = pipeline.start();
        loop.runPending();

        assertTrue(result.isCompletedExceptionally());
        verify(setupPort, never()).generateQuestions(anyString(), anyString(), anyInt());
        verify(setupPort, never()).createSession(any());
        verify(supervisor, never()).attach(any());
        verify(metrics).incrementSetupFailure(SetupStep.ANALYZE);
        assertEquals(List.of("Setup failed: Analysis service unavailable"), sink.messages());
        assertEquals(List.of("processing", "setup"), sink.sections());
    }

    @Test
    void start_reportsStepSpecificTimeoutMessage() {
        fillValidForm();
        when(setupPort.upload(any(), any())).thenReturn(new CompletableFuture<>());

        CompletableFuture<SessionDescriptor> result = pipeline.start();
        loop.advanceBy(Duration.ofMillis(29_999));
        assertFalse(result.isDone());
        loop.advanceBy(Duration.ofMillis(1));

        assertTrue(result.isCompletedExceptionally());
        assertEquals(List.of("Setup failed: File upload timed out. Please try again with smaller files."), sink.messages());
        verify(setupPort, never()).analyze(anyString(), anyString());
    }

    @Test
    void start_rejectsInvalidFormWithoutCallingBackend() {
        formGate.updateFields("Jane Doe", "", "jane@example.com");

        CompletableFuture<SessionDescriptor> result = pipeline.start();

        assertTrue(result.isCompletedExceptionally());
        assertEquals(List.of("Please fill in all required fields correctly."), sink.messages());
        verifyNoInteractions(setupPort);
    }

    @Test
    void start_rejectsSecondSubmitWhileRunning() {
        fillValidForm();
        when(setupPort.upload(any(), any())).thenReturn(new CompletableFuture<>());

        pipeline.start();
        CompletableFuture<SessionDescriptor> second = pipeline.start();

        assertTrue(pipeline.isRunning());
        assertTrue(second.isCompletedExceptionally());
        verify(setupPort).upload(any(), any());
    }

    @Test
    void start_rejectsWhileInterviewIsActive() {
        fillValidForm();
        when(supervisor.acceptsNewSession()).thenReturn(false);

        CompletableFuture<SessionDescriptor> result = pipeline.start();

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertTrue(error.getCause() instanceof IllegalStateException);
        assertFalse(pipeline.isRunning());
        assertTrue(sink.sections().isEmpty());
        verifyNoInteractions(setupPort);
        verify(supervisor, never()).attach(any());
    }

    @Test
    void start_keepsLiveSessionWhenItConnectedDuringSetup() {
        fillValidForm();
        SessionDescriptor descriptor = Fixtures.descriptor();
        stubUploadAndAnalyze();
        when(setupPort.generateQuestions("jd text", "resume text", 6))
                .thenReturn(completedFuture(QuestionsResult.succeeded(descriptor.questions())));
        when(setupPort.createSession(any())).thenReturn(completedFuture(SessionCreationResult.succeeded(descriptor)));
        when(supervisor.acceptsNewSession()).thenReturn(true, false);

        CompletableFuture<SessionDescriptor> result = pipeline.start();
        loop.runPending();

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertTrue(error.getCause() instanceof IllegalStateException);
        verify(supervisor, never()).attach(any());
        verify(supervisor, never()).scheduleConnect(any());
        assertEquals(List.of("processing", "voice"), sink.sections());
    }

    @Test
    void start_discardsResultWhenConsoleWasResetMeanwhile() {
        fillValidForm();
        CompletableFuture<UploadResult> upload = new CompletableFuture<>();
        when(setupPort.upload(any(), any())).thenReturn(upload);
        when(supervisor.generation()).thenReturn(0L, 1L);

        CompletableFuture<SessionDescriptor> result = pipeline.start();
        upload.complete(UploadResult.failed("late"));
        loop.runPending();

        assertTrue(result.isCompletedExceptionally());
        assertTrue(sink.messages().isEmpty());
        verify(setupPort, never()).analyze(anyString(), eq("resume text"));
    }

    private void fillValidForm() {
        formGate.updateFields("Jane Doe", "Backend Engineer", "jane@example.com");
        formGate.attach(AttachmentSlot.JOB_DESCRIPTION, Fixtures.jobDescription());
        formGate.attach(AttachmentSlot.RESUME, Fixtures.resume());
    }

    private void stubUploadAndAnalyze() {
        when(setupPort.upload(any(), any()))
                .thenReturn(completedFuture(UploadResult.succeeded("jd text", "resume text")));
        when(setupPort.analyze("jd text", "resume text"))
                .thenReturn(completedFuture(AnalysisResult.succeeded(Map.of("fit", "strong"))));
    }
}
