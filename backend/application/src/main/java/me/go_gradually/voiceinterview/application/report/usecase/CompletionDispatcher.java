package me.go_gradually.voiceinterview.application.report.usecase;

import me.go_gradually.voiceinterview.application.report.model.ReportDispatchResult;
import me.go_gradually.voiceinterview.application.report.policy.CompletionPolicy;
import me.go_gradually.voiceinterview.application.report.port.ReportPort;
import me.go_gradually.voiceinterview.application.shared.async.Timeouts;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.MetricsPort;
import me.go_gradually.voiceinterview.application.shared.port.ScheduledTask;
import me.go_gradually.voiceinterview.application.view.model.InterviewSection;
import me.go_gradually.voiceinterview.application.view.model.MessageArea;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;
import me.go_gradually.voiceinterview.domain.report.ReportDispatchOutcome;
import me.go_gradually.voiceinterview.domain.report.ReportDocument;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.session.SessionId;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

public class CompletionDispatcher {
    private static final Logger log = Logger.getLogger(CompletionDispatcher.class.getName());
    static final String SENT_MESSAGE = "Interview completed! Report has been sent to HR and your email.";
    static final String UNREACHABLE_MESSAGE =
            "Interview completed, but the report service could not be reached. Please download it manually.";

    private final ReportPort reportPort;
    private final ReportArchive archive;
    private final CompletionPolicy policy;
    private final EventLoop loop;
    private final InterviewView view;
    private final MetricsPort metrics;

    public CompletionDispatcher(ReportPort reportPort,
                                ReportArchive archive,
                                CompletionPolicy policy,
                                EventLoop loop,
                                InterviewView view,
                                MetricsPort metrics) {
        this.reportPort = reportPort;
        this.archive = archive;
        this.policy = policy;
        this.loop = loop;
        this.view = view;
        this.metrics = metrics;
    }

    /**
     * Fires the report email request and, after the results delay, moves to results and downloads the report.
     * Cancelling the returned ticket drops every later view update of this dispatch.
     */
    public ScheduledTask dispatchCompleted(SessionDescriptor descriptor) {
        DispatchTicket ticket = new DispatchTicket();
        SessionId sessionId = descriptor.sessionId();
        Timeouts.invoke(() -> reportPort.sendReport(sessionId))
                .whenCompleteAsync((result, error) -> onDispatched(ticket, sessionId, result, error), loop.asExecutor());
        ticket.resultsTask = loop.schedule(() -> {
            if (ticket.cancelled) {
                return;
            }
            view.showSection(InterviewSection.RESULTS);
            download(sessionId, ticket);
        }, policy.resultsDelay());
        return ticket;
    }

    public ScheduledTask showResultsWithoutReport() {
        DispatchTicket ticket = new DispatchTicket();
        ticket.resultsTask = loop.schedule(() -> {
            if (!ticket.cancelled) {
                view.showSection(InterviewSection.RESULTS);
            }
        }, policy.resultsDelay());
        return ticket;
    }

    public CompletableFuture<ReportDocument> downloadReport(SessionId sessionId) {
        return download(sessionId, new DispatchTicket());
    }

    private void onDispatched(DispatchTicket ticket, SessionId sessionId, ReportDispatchResult result, Throwable error) {
        if (ticket.cancelled) {
            return;
        }
        if (error != null) {
            metrics.incrementReportDispatch(ReportDispatchOutcome.UNREACHABLE);
            log.warning("report.dispatch unreachable session=" + sessionId.value()
                    + " reason=" + Timeouts.messageOf(error));
            view.showMessage(MessageArea.VOICE, MessageLevel.WARNING, UNREACHABLE_MESSAGE);
            return;
        }
        if (result != null && result.success()) {
            metrics.incrementReportDispatch(ReportDispatchOutcome.SENT);
            view.showMessage(MessageArea.VOICE, MessageLevel.SUCCESS, SENT_MESSAGE);
            return;
        }
        metrics.incrementReportDispatch(ReportDispatchOutcome.REJECTED);
        String reason = result == null || result.message() == null || result.message().isBlank()
                ? "unknown error" : result.message();
        log.warning("report.dispatch rejected session=" + sessionId.value() + " reason=" + reason);
        view.showMessage(MessageArea.VOICE, MessageLevel.WARNING,
                "Interview completed, but the report could not be sent: " + reason + ". Please download it manually.");
    }

    private CompletableFuture<ReportDocument> download(SessionId sessionId, DispatchTicket ticket) {
        return Timeouts.invoke(() -> reportPort.downloadReport(sessionId))
                .whenCompleteAsync((document, error) -> {
                    if (ticket.cancelled) {
                        return;
                    }
                    if (error != null) {
                        log.warning("report.download failure session=" + sessionId.value()
                                + " reason=" + Timeouts.messageOf(error));
                        view.showMessage(MessageArea.RESULTS, MessageLevel.DANGER,
                                "Report download failed: " + Timeouts.messageOf(error));
                        return;
                    }
                    archive.store(document);
                    view.reportReady(document);
                    view.showMessage(MessageArea.RESULTS, MessageLevel.SUCCESS,
                            "Report downloaded as " + document.fileName());
                }, loop.asExecutor());
    }

    private static final class DispatchTicket implements ScheduledTask {
        private volatile boolean cancelled;
        private ScheduledTask resultsTask;

        @Override
        public void cancel() {
            cancelled = true;
            ScheduledTask.cancelIfPresent(resultsTask);
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
