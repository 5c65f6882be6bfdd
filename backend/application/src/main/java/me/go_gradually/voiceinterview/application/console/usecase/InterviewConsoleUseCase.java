package me.go_gradually.voiceinterview.application.console.usecase;

import me.go_gradually.voiceinterview.application.connection.model.InterviewSnapshot;
import me.go_gradually.voiceinterview.application.connection.usecase.ConnectionSupervisor;
import me.go_gradually.voiceinterview.application.form.usecase.FormGateUseCase;
import me.go_gradually.voiceinterview.application.health.usecase.SystemStatusUseCase;
import me.go_gradually.voiceinterview.application.report.usecase.CompletionDispatcher;
import me.go_gradually.voiceinterview.application.report.usecase.ReportArchive;
import me.go_gradually.voiceinterview.application.setup.usecase.SetupPipelineUseCase;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.view.model.InterviewEventSink;
import me.go_gradually.voiceinterview.application.view.model.InterviewSection;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;
import me.go_gradually.voiceinterview.domain.form.Attachment;
import me.go_gradually.voiceinterview.domain.form.AttachmentSlot;
import me.go_gradually.voiceinterview.domain.report.ReportDocument;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Thread-safe entry point for the console surface. Every call is marshalled onto the event loop.
 */
public class InterviewConsoleUseCase {
    private final EventLoop loop;
    private final FormGateUseCase formGate;
    private final SetupPipelineUseCase setupPipeline;
    private final ConnectionSupervisor supervisor;
    private final CompletionDispatcher completionDispatcher;
    private final ReportArchive reportArchive;
    private final SystemStatusUseCase systemStatus;
    private final InterviewView view;

    public InterviewConsoleUseCase(EventLoop loop,
                                   FormGateUseCase formGate,
                                   SetupPipelineUseCase setupPipeline,
                                   ConnectionSupervisor supervisor,
                                   CompletionDispatcher completionDispatcher,
                                   ReportArchive reportArchive,
                                   SystemStatusUseCase systemStatus,
                                   InterviewView view) {
        this.loop = loop;
        this.formGate = formGate;
        this.setupPipeline = setupPipeline;
        this.supervisor = supervisor;
        this.completionDispatcher = completionDispatcher;
        this.reportArchive = reportArchive;
        this.systemStatus = systemStatus;
        this.view = view;
    }

    public void subscribe(InterviewEventSink sink) {
        view.register(sink);
    }

    public void unsubscribe(InterviewEventSink sink) {
        view.unregister(sink);
    }

    public void updateForm(String name, String position, String email) {
        loop.execute(() -> formGate.updateFields(name, position, email));
    }

    public CompletableFuture<Boolean> attach(AttachmentSlot slot, Attachment attachment) {
        if (slot == null || attachment == null) {
            throw new IllegalArgumentException("slot and attachment are required");
        }
        return onLoop(() -> formGate.attach(slot, attachment));
    }

    public void detach(AttachmentSlot slot) {
        if (slot == null) {
            throw new IllegalArgumentException("slot is required");
        }
        loop.execute(() -> formGate.detach(slot));
    }

    public CompletableFuture<SessionDescriptor> startSetup() {
        return onLoop(setupPipeline::start).thenCompose(started -> started);
    }

    public void connect() {
        loop.execute(supervisor::connect);
    }

    public void disconnect() {
        loop.execute(supervisor::disconnect);
    }

    public void startNewInterview() {
        loop.execute(() -> {
            supervisor.startNewInterview();
            formGate.reset();
            reportArchive.clear();
            view.clearReport();
            view.clearAllMessages();
            view.showSection(InterviewSection.SETUP);
        });
    }

    public CompletableFuture<MessageLevel> checkSystemStatus() {
        return onLoop(systemStatus::check).thenCompose(checked -> checked);
    }

    public CompletableFuture<InterviewSnapshot> snapshot() {
        return onLoop(supervisor::snapshot);
    }

    public Optional<ReportDocument> latestReport() {
        return reportArchive.latest();
    }

    public CompletableFuture<ReportDocument> downloadReport() {
        return onLoop(() -> {
            SessionDescriptor descriptor = supervisor.snapshot().currentDescriptor()
                    .orElseThrow(() -> new NoSuchElementException("No interview session to download a report for"));
            return completionDispatcher.downloadReport(descriptor.sessionId());
        }).thenCompose(download -> download);
    }

    private <T> CompletableFuture<T> onLoop(Supplier<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        loop.execute(() -> {
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }
}
