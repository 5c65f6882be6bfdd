package me.go_gradually.voiceinterview.application.status.usecase;

import me.go_gradually.voiceinterview.application.report.usecase.CompletionDispatcher;
import me.go_gradually.voiceinterview.application.session.port.SessionStatusPort;
import me.go_gradually.voiceinterview.application.shared.async.Timeouts;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.MetricsPort;
import me.go_gradually.voiceinterview.application.shared.port.ScheduledTask;
import me.go_gradually.voiceinterview.application.status.model.ReconciliationHandle;
import me.go_gradually.voiceinterview.application.status.model.ReconciliationListener;
import me.go_gradually.voiceinterview.application.status.policy.StatusPollPolicy;
import me.go_gradually.voiceinterview.application.view.model.MessageArea;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;
import me.go_gradually.voiceinterview.domain.connection.ConnectionState;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.session.SessionStatus;
import me.go_gradually.voiceinterview.domain.status.PollCycle;
import me.go_gradually.voiceinterview.domain.status.StatusReconciliationPolicy;
import me.go_gradually.voiceinterview.domain.status.StatusReconciliationPolicy.ReconciliationAction;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Polls backend session status after the interviewer leaves. Runs on the event loop.
 */
public class StatusReconciler {
    private static final Logger log = Logger.getLogger(StatusReconciler.class.getName());
    static final String IN_PROGRESS_MESSAGE = "Interview is currently in progress...";
    static final String GAVE_UP_MESSAGE = "Interview status update timed out. Please check manually.";

    private final SessionStatusPort statusPort;
    private final CompletionDispatcher dispatcher;
    private final StatusPollPolicy policy;
    private final EventLoop loop;
    private final InterviewView view;
    private final MetricsPort metrics;

    public StatusReconciler(SessionStatusPort statusPort,
                            CompletionDispatcher dispatcher,
                            StatusPollPolicy policy,
                            EventLoop loop,
                            InterviewView view,
                            MetricsPort metrics) {
        this.statusPort = statusPort;
        this.dispatcher = dispatcher;
        this.policy = policy;
        this.loop = loop;
        this.view = view;
        this.metrics = metrics;
    }

    public ReconciliationHandle start(SessionDescriptor descriptor, ReconciliationListener listener) {
        PollRun run = new PollRun(descriptor, new PollCycle(policy.maxPollAttempts(), policy.pollInterval()), listener);
        run.pollTask = loop.scheduleAtFixedRate(() -> tick(run), Duration.ZERO, policy.pollInterval());
        log.info(() -> "status.reconcile start session=" + descriptor.sessionId().value());
        return run;
    }

    private void tick(PollRun run) {
        if (run.finished) {
            return;
        }
        if (run.inFlight) {
            // a hung poll still uses up the tick
            log.fine(() -> "status.reconcile tick skipped session=" + run.descriptor.sessionId().value()
                    + " attempt=" + (run.cycle.attempts() + 1));
            countAttempt(run);
            return;
        }
        run.inFlight = true;
        Timeouts.within(() -> statusPort.fetchStatus(run.descriptor.sessionId()), policy.pollRequestTimeout(), loop,
                        () -> new IllegalStateException("Status request timed out"))
                .whenCompleteAsync((status, error) -> onResult(run, status, error), loop.asExecutor());
    }

    private void onResult(PollRun run, SessionStatus status, Throwable error) {
        run.inFlight = false;
        if (run.finished) {
            return;
        }
        metrics.incrementStatusPoll();
        if (error != null) {
            metrics.incrementStatusPollError();
            log.warning("status.reconcile poll failure session=" + run.descriptor.sessionId().value()
                    + " attempt=" + (run.cycle.attempts() + 1) + " reason=" + Timeouts.messageOf(error));
            countAttempt(run);
            return;
        }
        ReconciliationAction action = StatusReconciliationPolicy.decide(status);
        switch (action) {
            case DISPATCH_REPORT -> {
                finish(run);
                run.listener.onResolved(SessionStatus.COMPLETED);
                view.connectionStatus(ConnectionState.DISCONNECTED, "Interview completed");
                view.showMessage(MessageArea.VOICE, MessageLevel.SUCCESS, "Interview completed! Generating report...");
                run.followUp = dispatcher.dispatchCompleted(run.descriptor);
            }
            case END_WITHOUT_REPORT -> {
                finish(run);
                run.listener.onResolved(SessionStatus.DISCONNECTED);
                view.connectionStatus(ConnectionState.DISCONNECTED, "Interview session ended");
                view.showMessage(MessageArea.VOICE, MessageLevel.INFO, "Interview session has ended.");
                run.followUp = dispatcher.showResultsWithoutReport();
            }
            case FAIL -> {
                finish(run);
                run.listener.onResolved(SessionStatus.FAILED);
                view.connectionStatus(ConnectionState.DISCONNECTED, "Interview session failed");
                view.showMessage(MessageArea.VOICE, MessageLevel.DANGER,
                        "The interview session ended with an error. Please contact support if your report does not arrive.");
                run.followUp = dispatcher.showResultsWithoutReport();
            }
            case KEEP_POLLING -> {
                if (status != null && status.isLive()) {
                    view.showMessage(MessageArea.VOICE, MessageLevel.INFO, IN_PROGRESS_MESSAGE);
                }
                countAttempt(run);
            }
        }
    }

    private void countAttempt(PollRun run) {
        if (run.cycle.recordAttempt()) {
            finish(run);
            log.warning("status.reconcile gave_up session=" + run.descriptor.sessionId().value()
                    + " attempts=" + run.cycle.attempts());
            view.showMessage(MessageArea.VOICE, MessageLevel.WARNING, GAVE_UP_MESSAGE);
            run.listener.onGaveUp();
        }
    }

    private void finish(PollRun run) {
        run.finished = true;
        ScheduledTask.cancelIfPresent(run.pollTask);
    }

    private static final class PollRun implements ReconciliationHandle {
        private final SessionDescriptor descriptor;
        private final PollCycle cycle;
        private final ReconciliationListener listener;
        private ScheduledTask pollTask;
        private ScheduledTask followUp;
        private boolean inFlight;
        private boolean finished;
        private boolean cancelled;

        private PollRun(SessionDescriptor descriptor, PollCycle cycle, ReconciliationListener listener) {
            this.descriptor = descriptor;
            this.cycle = cycle;
            this.listener = listener;
        }

        @Override
        public void cancel() {
            cancelled = true;
            finished = true;
            ScheduledTask.cancelIfPresent(pollTask);
            ScheduledTask.cancelIfPresent(followUp);
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isFinished() {
            return finished;
        }

        @Override
        public int attempts() {
            return cycle.attempts();
        }
    }
}
