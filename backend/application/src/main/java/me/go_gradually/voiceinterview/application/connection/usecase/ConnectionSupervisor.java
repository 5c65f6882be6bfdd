package me.go_gradually.voiceinterview.application.connection.usecase;

import me.go_gradually.voiceinterview.application.connection.model.ConnectionAttempt;
import me.go_gradually.voiceinterview.application.connection.model.ConnectionFailure;
import me.go_gradually.voiceinterview.application.connection.model.InterviewSnapshot;
import me.go_gradually.voiceinterview.application.connection.model.LocalAudioSnapshot;
import me.go_gradually.voiceinterview.application.connection.model.ParticipantLevel;
import me.go_gradually.voiceinterview.application.connection.model.RoomEvent;
import me.go_gradually.voiceinterview.application.connection.policy.ConnectionPolicy;
import me.go_gradually.voiceinterview.application.connection.port.RealtimeRoom;
import me.go_gradually.voiceinterview.application.shared.async.Timeouts;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.MetricsPort;
import me.go_gradually.voiceinterview.application.shared.port.ScheduledTask;
import me.go_gradually.voiceinterview.application.status.model.ReconciliationHandle;
import me.go_gradually.voiceinterview.application.status.model.ReconciliationListener;
import me.go_gradually.voiceinterview.application.status.usecase.StatusReconciler;
import me.go_gradually.voiceinterview.application.view.model.InterviewSection;
import me.go_gradually.voiceinterview.application.view.model.MessageArea;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;
import me.go_gradually.voiceinterview.domain.connection.ConnectionFailurePolicy;
import me.go_gradually.voiceinterview.domain.connection.ConnectionState;
import me.go_gradually.voiceinterview.domain.connection.RetryBudget;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.session.SessionStatus;

import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

/**
 * Sole owner of the interview context. Wraps the {@link SessionConnector} with retry and backoff,
 * reacts to room events and hands completion off to the {@link StatusReconciler}.
 * <p>
 * Every method must be called on the event loop. Scheduled callbacks capture the context generation
 * and do nothing once {@link #startNewInterview()} has bumped it.
 */
public class ConnectionSupervisor {
    private static final Logger log = Logger.getLogger(ConnectionSupervisor.class.getName());
    static final String NO_SESSION_MESSAGE = "No session data available. Please restart the setup process.";
    static final String INTERVIEWER_JOINED_MESSAGE = "AI interviewer has joined! The interview will begin shortly.";
    static final String INTERVIEWER_LEFT_MESSAGE = "AI interviewer has finished. Checking interview status...";
    static final String CONNECTION_LOST_MESSAGE =
            "Connection to interview room was lost. You can reconnect or the interview may be complete.";
    static final String USER_DISCONNECT_MESSAGE = "You have disconnected from the interview.";
    private static final String UNKNOWN_IDENTITY = "unknown";

    private final SessionConnector connector;
    private final StatusReconciler reconciler;
    private final ConnectionPolicy policy;
    private final EventLoop loop;
    private final InterviewView view;
    private final MetricsPort metrics;
    private final InterviewContext context;

    public ConnectionSupervisor(SessionConnector connector,
                                StatusReconciler reconciler,
                                ConnectionPolicy policy,
                                EventLoop loop,
                                InterviewView view,
                                MetricsPort metrics) {
        this.connector = connector;
        this.reconciler = reconciler;
        this.policy = policy;
        this.loop = loop;
        this.view = view;
        this.metrics = metrics;
        this.context = new InterviewContext(new RetryBudget(policy.maxConnectionAttempts(), policy.retryBaseDelay()));
    }

    public long generation() {
        return context.generation;
    }

    public InterviewSnapshot snapshot() {
        return new InterviewSnapshot(
                context.state,
                context.descriptor,
                context.sessionStatus,
                context.retryBudget.attempts(),
                context.isReconciling(),
                context.generation
        );
    }

    /**
     * A new session may be set up only while nothing is attached or the console is idle.
     */
    public boolean acceptsNewSession() {
        return context.descriptor == null || context.state == ConnectionState.IDLE;
    }

    public void attach(SessionDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor is required");
        }
        if (context.state == ConnectionState.CONNECTING || context.state.isOnline()) {
            throw new IllegalStateException("Cannot attach a new session while state is " + context.state.code());
        }
        context.descriptor = descriptor;
        context.sessionStatus = SessionStatus.CREATED;
        context.retryBudget.reset();
        view.connectionStatus(context.state, "Ready to connect");
    }

    public void scheduleConnect(Duration delay) {
        ScheduledTask.cancelIfPresent(context.autoConnectTask);
        context.autoConnectTask = loop.schedule(guarded(this::connect), delay);
    }

    public void connect() {
        ScheduledTask.cancelIfPresent(context.autoConnectTask);
        context.autoConnectTask = null;
        if (context.descriptor == null) {
            view.showMessage(MessageArea.VOICE, MessageLevel.DANGER, NO_SESSION_MESSAGE);
            return;
        }
        if (!context.state.acceptsConnectRequest()) {
            log.fine(() -> "connection.connect ignored state=" + context.state.code());
            return;
        }
        ScheduledTask.cancelIfPresent(context.resultsDelayTask);
        context.resultsDelayTask = null;
        context.retryBudget.reset();
        view.clearMessage(MessageArea.VOICE);
        transition(ConnectionState.CONNECTING, "Connecting to interview room...");
        attemptConnection();
    }

    public void disconnect() {
        boolean active = context.state.isOnline() || context.state == ConnectionState.CONNECTING;
        if (context.descriptor == null || !active) {
            return;
        }
        cancelConnectionWork();
        cancelReconciliation();
        releaseRoom();
        transition(ConnectionState.DISCONNECTED, "Disconnected from interview");
        view.showMessage(MessageArea.VOICE, MessageLevel.INFO, USER_DISCONNECT_MESSAGE);
        ScheduledTask.cancelIfPresent(context.resultsDelayTask);
        context.resultsDelayTask = loop.schedule(guarded(() -> view.showSection(InterviewSection.RESULTS)),
                policy.disconnectResultsDelay());
        log.info(() -> "connection.disconnect by=user session=" + context.descriptor.sessionId().value());
    }

    public void startNewInterview() {
        context.generation++;
        cancelConnectionWork();
        cancelReconciliation();
        ScheduledTask.cancelIfPresent(context.resultsDelayTask);
        context.resultsDelayTask = null;
        releaseRoom();
        context.descriptor = null;
        context.sessionStatus = null;
        context.retryBudget.reset();
        context.state = ConnectionState.IDLE;
        view.connectionStatus(ConnectionState.IDLE, "Not connected");
        view.audioLevels(0, 0);
    }

    private void attemptConnection() {
        context.retryTask = null;
        context.retryBudget.recordAttempt();
        metrics.incrementConnectionAttempt();
        long generation = context.generation;
        long attemptId = ++context.attemptSequence;
        ConnectionAttempt attempt = connector.connect(context.descriptor,
                event -> loop.execute(() -> onRoomEvent(generation, attemptId, event)));
        context.attempt = attempt;
        attempt.outcome().whenCompleteAsync(
                (room, error) -> onAttemptSettled(generation, attemptId, attempt, room, error), loop.asExecutor());
    }

    private void onAttemptSettled(long generation,
                                  long attemptId,
                                  ConnectionAttempt attempt,
                                  RealtimeRoom room,
                                  Throwable error) {
        if (generation != context.generation || attemptId != context.attemptSequence) {
            if (error == null && room != null) {
                room.disconnect();
            }
            return;
        }
        context.attempt = null;
        if (error == null) {
            context.room = room;
            context.retryBudget.reset();
            view.clearMessage(MessageArea.VOICE);
            transition(ConnectionState.CONNECTED, "Connected to interview - waiting for AI interviewer");
            startAudioSampler();
            log.info(() -> "connection.attempt success session=" + context.descriptor.sessionId().value());
            return;
        }
        ConnectionFailure failure = ConnectionFailure.classify(error);
        attempt.release();
        metrics.incrementConnectionFailure(failure.failureCause());
        ConnectionFailurePolicy.RetryDecision decision =
                ConnectionFailurePolicy.decide(failure.failureCause(), context.retryBudget);
        int attempts = context.retryBudget.attempts();
        if (decision.shouldRetry()) {
            metrics.incrementConnectionRetry();
            log.warning("connection.attempt failure cause=" + failure.failureCause()
                    + " attempt=" + attempts + " retry_in_ms=" + decision.delay().toMillis()
                    + " reason=" + failure.getMessage());
            view.connectionStatus(ConnectionState.CONNECTING, "Connection failed, retrying... ("
                    + attempts + "/" + context.retryBudget.maxAttempts() + ")");
            context.retryTask = loop.schedule(guarded(this::attemptConnection), decision.delay());
            return;
        }
        log.warning("connection.attempt gave_up cause=" + failure.failureCause()
                + " attempts=" + attempts + " reason=" + failure.getMessage());
        context.retryBudget.reset();
        transition(ConnectionState.ERROR, "Connection failed");
        view.showMessage(MessageArea.VOICE, MessageLevel.DANGER, failure.userMessage());
    }

    private void onRoomEvent(long generation, long attemptId, RoomEvent event) {
        if (generation != context.generation || attemptId != context.attemptSequence) {
            log.fine(() -> "connection.room_event stale type=" + event.type());
            return;
        }
        String identity = event.participantIdentity();
        switch (event.type()) {
            case PARTICIPANT_CONNECTED -> {
                if (isInterviewer(identity)) {
                    view.participantJoined(identity);
                    view.showMessage(MessageArea.VOICE, MessageLevel.SUCCESS, INTERVIEWER_JOINED_MESSAGE);
                    if (context.state == ConnectionState.CONNECTED) {
                        view.connectionStatus(ConnectionState.CONNECTED, "AI interviewer connected - Interview starting");
                    }
                }
            }
            case PARTICIPANT_DISCONNECTED -> {
                if (isInterviewer(identity) && context.state.isOnline()) {
                    startReconciliation();
                }
            }
            case TRACK_SUBSCRIBED -> {
                if (isInterviewer(identity)) {
                    view.trackSubscribed(identity, event.trackKind());
                }
            }
            case TRACK_UNSUBSCRIBED -> {
                if (isInterviewer(identity)) {
                    view.trackUnsubscribed(identity, event.trackKind());
                }
            }
            case RECONNECTING -> {
                if (context.state == ConnectionState.CONNECTED) {
                    transition(ConnectionState.RECONNECTING, "Reconnecting to interview room...");
                }
            }
            case RECONNECTED -> {
                if (context.state == ConnectionState.RECONNECTING) {
                    transition(ConnectionState.CONNECTED, "Reconnected to interview room");
                }
            }
            case CONNECTION_QUALITY_CHANGED -> {
                if (event.local() && event.quality() != null) {
                    view.connectionQuality(event.quality());
                }
            }
            case DISCONNECTED -> onTransportDisconnected(event.reason());
        }
    }

    private void onTransportDisconnected(String reason) {
        if (!context.state.isOnline()) {
            return;
        }
        releaseRoom();
        transition(ConnectionState.DISCONNECTED, "Disconnected from interview");
        log.warning("connection.transport disconnected session=" + context.descriptor.sessionId().value()
                + " reason=" + reason + " reconciling=" + context.isReconciling());
        if (!context.isReconciling()) {
            view.showMessage(MessageArea.VOICE, MessageLevel.WARNING, CONNECTION_LOST_MESSAGE);
        }
    }

    private void startReconciliation() {
        if (context.isReconciling()) {
            return;
        }
        view.showMessage(MessageArea.VOICE, MessageLevel.INFO, INTERVIEWER_LEFT_MESSAGE);
        view.connectionStatus(context.state, "Checking interview status...");
        long generation = context.generation;
        context.reconciliation = reconciler.start(context.descriptor, new ReconciliationListener() {
            @Override
            public void onResolved(SessionStatus status) {
                if (generation != context.generation) {
                    return;
                }
                context.sessionStatus = status;
                if (status.isTerminal()) {
                    releaseRoom();
                    context.state = ConnectionState.DISCONNECTED;
                }
            }

            @Override
            public void onGaveUp() {
                if (generation == context.generation) {
                    context.sessionStatus = SessionStatus.UNKNOWN;
                }
            }
        });
    }

    private void startAudioSampler() {
        ScheduledTask.cancelIfPresent(context.audioSampler);
        long generation = context.generation;
        Duration interval = policy.audioSampleInterval();
        context.audioSampler = loop.scheduleAtFixedRate(() -> sampleAudio(generation), interval, interval);
    }

    private void sampleAudio(long generation) {
        RealtimeRoom room = context.room;
        if (generation != context.generation || room == null) {
            return;
        }
        try {
            LocalAudioSnapshot local = room.localAudio();
            int microphone = toPercent(local == null ? 0.0 : local.level());
            int interviewer = 0;
            List<ParticipantLevel> levels = room.remoteAudioLevels();
            if (levels != null) {
                for (ParticipantLevel level : levels) {
                    if (isInterviewer(level.identity())) {
                        interviewer = Math.max(interviewer, toPercent(level.level()));
                    }
                }
            }
            view.audioLevels(microphone, interviewer);
        } catch (RuntimeException e) {
            log.fine(() -> "connection.audio_sample failure reason=" + Timeouts.messageOf(e));
        }
    }

    private void cancelConnectionWork() {
        ScheduledTask.cancelIfPresent(context.autoConnectTask);
        ScheduledTask.cancelIfPresent(context.retryTask);
        context.autoConnectTask = null;
        context.retryTask = null;
        if (context.attempt != null) {
            context.attempt.abandon();
            context.attempt = null;
        }
        context.attemptSequence++;
    }

    private void cancelReconciliation() {
        ScheduledTask.cancelIfPresent(context.reconciliation);
        context.reconciliation = null;
    }

    private void releaseRoom() {
        ScheduledTask.cancelIfPresent(context.audioSampler);
        context.audioSampler = null;
        RealtimeRoom room = context.room;
        context.room = null;
        if (room != null) {
            room.disconnect();
        }
    }

    private void transition(ConnectionState next, String statusText) {
        context.state = next;
        view.connectionStatus(next, statusText);
    }

    private boolean isInterviewer(String identity) {
        if (identity == null || identity.isBlank() || UNKNOWN_IDENTITY.equals(identity)) {
            return false;
        }
        return context.descriptor == null || !identity.equals(context.descriptor.candidateName());
    }

    private Runnable guarded(Runnable task) {
        long generation = context.generation;
        return () -> {
            if (generation == context.generation) {
                task.run();
            }
        };
    }

    private static int toPercent(double level) {
        double clamped = Math.max(0.0, Math.min(1.0, level));
        return (int) Math.round(clamped * 100);
    }

    private static final class InterviewContext {
        private final RetryBudget retryBudget;
        private SessionDescriptor descriptor;
        private ConnectionState state = ConnectionState.IDLE;
        private SessionStatus sessionStatus;
        private RealtimeRoom room;
        private ConnectionAttempt attempt;
        private long attemptSequence;
        private long generation;
        private ScheduledTask autoConnectTask;
        private ScheduledTask retryTask;
        private ScheduledTask audioSampler;
        private ScheduledTask resultsDelayTask;
        private ReconciliationHandle reconciliation;

        private InterviewContext(RetryBudget retryBudget) {
            this.retryBudget = retryBudget;
        }

        private boolean isReconciling() {
            return reconciliation != null && !reconciliation.isFinished();
        }
    }
}
