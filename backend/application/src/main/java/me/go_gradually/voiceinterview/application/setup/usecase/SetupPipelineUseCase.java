package me.go_gradually.voiceinterview.application.setup.usecase;

import me.go_gradually.voiceinterview.application.connection.usecase.ConnectionSupervisor;
import me.go_gradually.voiceinterview.application.form.usecase.FormGateUseCase;
import me.go_gradually.voiceinterview.application.setup.model.AnalysisResult;
import me.go_gradually.voiceinterview.application.setup.model.QuestionsResult;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationCommand;
import me.go_gradually.voiceinterview.application.setup.model.SessionCreationResult;
import me.go_gradually.voiceinterview.application.setup.model.SetupStepException;
import me.go_gradually.voiceinterview.application.setup.model.StepResult;
import me.go_gradually.voiceinterview.application.setup.model.UploadResult;
import me.go_gradually.voiceinterview.application.setup.policy.SetupPolicy;
import me.go_gradually.voiceinterview.application.setup.port.InterviewSetupPort;
import me.go_gradually.voiceinterview.application.shared.async.Timeouts;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.MetricsPort;
import me.go_gradually.voiceinterview.application.view.model.InterviewSection;
import me.go_gradually.voiceinterview.application.view.model.MessageArea;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;
import me.go_gradually.voiceinterview.domain.form.CandidateForm;
import me.go_gradually.voiceinterview.domain.form.FormValidation;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.setup.SetupProgress;
import me.go_gradually.voiceinterview.domain.setup.SetupStep;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * upload, analyze, generate-questions, create-session. Strictly ordered, no retries.
 * Entry points run on the event loop.
 */
public class SetupPipelineUseCase {
    private static final Logger log = Logger.getLogger(SetupPipelineUseCase.class.getName());
    static final String INVALID_FORM_MESSAGE = "Please fill in all required fields correctly.";
    static final String SESSION_ACTIVE_MESSAGE = "An interview session is already in progress. Start a new interview first.";

    private final InterviewSetupPort setupPort;
    private final FormGateUseCase formGate;
    private final ConnectionSupervisor supervisor;
    private final SetupPolicy policy;
    private final EventLoop loop;
    private final InterviewView view;
    private final MetricsPort metrics;
    private Long runningGeneration;

    public SetupPipelineUseCase(InterviewSetupPort setupPort,
                                FormGateUseCase formGate,
                                ConnectionSupervisor supervisor,
                                SetupPolicy policy,
                                EventLoop loop,
                                InterviewView view,
                                MetricsPort metrics) {
        this.setupPort = setupPort;
        this.formGate = formGate;
        this.supervisor = supervisor;
        this.policy = policy;
        this.loop = loop;
        this.view = view;
        this.metrics = metrics;
    }

    public CompletableFuture<SessionDescriptor> start() {
        CompletableFuture<SessionDescriptor> result = new CompletableFuture<>();
        long generation = supervisor.generation();
        if (runningGeneration != null && runningGeneration == generation) {
            result.completeExceptionally(new IllegalStateException("Interview setup is already running"));
            return result;
        }
        if (!supervisor.acceptsNewSession()) {
            result.completeExceptionally(new IllegalStateException(SESSION_ACTIVE_MESSAGE));
            return result;
        }
        FormValidation validation = formGate.validateNow();
        if (!validation.valid()) {
            view.showMessage(MessageArea.SETUP, MessageLevel.DANGER, INVALID_FORM_MESSAGE);
            result.completeExceptionally(new IllegalArgumentException(INVALID_FORM_MESSAGE));
            return result;
        }
        CandidateForm form = formGate.currentForm();
        runningGeneration = generation;
        view.clearMessage(MessageArea.SETUP);
        view.showSection(InterviewSection.PROCESSING);
        view.setupProgress(SetupProgress.started());

        Executor executor = loop.asExecutor();
        SetupRun run = new SetupRun();
        runStep(SetupStep.UPLOAD, () -> setupPort.upload(form.jobDescription(), form.resume()))
                .thenComposeAsync(upload -> {
                    run.upload = upload;
                    stepCompleted(SetupStep.UPLOAD);
                    return runStep(SetupStep.ANALYZE,
                            () -> setupPort.analyze(upload.jobDescriptionText(), upload.resumeText()));
                }, executor)
                .thenComposeAsync(analysis -> {
                    run.analysis = analysis;
                    stepCompleted(SetupStep.ANALYZE);
                    return runStep(SetupStep.GENERATE_QUESTIONS, () -> setupPort.generateQuestions(
                            run.upload.jobDescriptionText(), run.upload.resumeText(), policy.questionCount()));
                }, executor)
                .thenComposeAsync(questions -> {
                    stepCompleted(SetupStep.GENERATE_QUESTIONS);
                    SessionCreationCommand command = toCommand(form, run, questions);
                    return runStep(SetupStep.CREATE_SESSION, () -> setupPort.createSession(command));
                }, executor)
                .whenCompleteAsync((created, error) -> finish(generation, created, error, result), executor);
        return result;
    }

    public boolean isRunning() {
        return runningGeneration != null && runningGeneration == supervisor.generation();
    }

    private <T extends StepResult> CompletableFuture<T> runStep(SetupStep step, Supplier<CompletableFuture<T>> call) {
        long startedAt = System.nanoTime();
        return Timeouts.within(call, policy.stepTimeout(step), loop,
                        () -> new SetupStepException(step, step.timeoutMessage(), true))
                .thenApply(stepResult -> {
                    if (stepResult == null || !stepResult.success()) {
                        throw new SetupStepException(step, failureMessage(step, stepResult), false);
                    }
                    metrics.recordSetupStepLatency(step, Duration.ofNanos(System.nanoTime() - startedAt));
                    return stepResult;
                });
    }

    private void stepCompleted(SetupStep step) {
        view.setupProgress(step.completedProgress());
    }

    private void finish(long generation,
                        SessionCreationResult created,
                        Throwable error,
                        CompletableFuture<SessionDescriptor> result) {
        if (runningGeneration != null && runningGeneration == generation) {
            runningGeneration = null;
        }
        if (supervisor.generation() != generation) {
            log.info("setup.pipeline discarded reason=reset");
            result.completeExceptionally(new IllegalStateException("Interview setup was reset"));
            return;
        }
        if (error != null) {
            Throwable cause = Timeouts.unwrap(error);
            if (cause instanceof SetupStepException stepFailure) {
                metrics.incrementSetupFailure(stepFailure.step());
                log.warning("setup.pipeline failure step=" + stepFailure.step().code()
                        + " timedOut=" + stepFailure.timedOut() + " reason=" + stepFailure.getMessage());
            } else {
                log.warning("setup.pipeline failure reason=" + Timeouts.messageOf(cause));
            }
            view.showSection(InterviewSection.SETUP);
            view.showMessage(MessageArea.SETUP, MessageLevel.DANGER, "Setup failed: " + Timeouts.messageOf(cause));
            result.completeExceptionally(cause);
            return;
        }
        SessionDescriptor descriptor = created.descriptor();
        if (descriptor == null) {
            view.showSection(InterviewSection.SETUP);
            view.showMessage(MessageArea.SETUP, MessageLevel.DANGER, "Setup failed: Session data is missing");
            result.completeExceptionally(new IllegalStateException("Session data is missing"));
            return;
        }
        if (!supervisor.acceptsNewSession()) {
            log.warning("setup.pipeline discarded reason=session_active session=" + descriptor.sessionId().value());
            view.showSection(InterviewSection.VOICE);
            result.completeExceptionally(new IllegalStateException(SESSION_ACTIVE_MESSAGE));
            return;
        }
        stepCompleted(SetupStep.CREATE_SESSION);
        supervisor.attach(descriptor);
        view.showSection(InterviewSection.VOICE);
        view.interviewProgress(0, descriptor.questionCount());
        supervisor.scheduleConnect(policy.autoConnectDelay());
        log.info(() -> "setup.pipeline complete session=" + descriptor.sessionId().value()
                + " questions=" + descriptor.questionCount());
        result.complete(descriptor);
    }

    private SessionCreationCommand toCommand(CandidateForm form, SetupRun run, QuestionsResult questions) {
        return new SessionCreationCommand(
                form.name().trim(),
                form.position().trim(),
                form.email().trim(),
                questions.questions(),
                run.analysis.analysis(),
                run.upload.jobDescriptionText(),
                run.upload.resumeText()
        );
    }

    private String failureMessage(SetupStep step, StepResult stepResult) {
        if (stepResult != null && stepResult.error() != null && !stepResult.error().isBlank()) {
            return stepResult.error();
        }
        return step.code() + " failed";
    }

    private static final class SetupRun {
        private UploadResult upload;
        private AnalysisResult analysis;
    }
}
