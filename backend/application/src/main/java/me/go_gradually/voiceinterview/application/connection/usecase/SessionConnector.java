package me.go_gradually.voiceinterview.application.connection.usecase;

import me.go_gradually.voiceinterview.application.connection.model.ConnectionAttempt;
import me.go_gradually.voiceinterview.application.connection.model.ConnectionFailure;
import me.go_gradually.voiceinterview.application.connection.model.LocalAudioSnapshot;
import me.go_gradually.voiceinterview.application.connection.model.RoomEventListener;
import me.go_gradually.voiceinterview.application.connection.policy.ConnectionPolicy;
import me.go_gradually.voiceinterview.application.connection.port.MicrophoneProbe;
import me.go_gradually.voiceinterview.application.connection.port.RealtimeRoom;
import me.go_gradually.voiceinterview.application.connection.port.RealtimeTransport;
import me.go_gradually.voiceinterview.application.session.port.SessionStatusPort;
import me.go_gradually.voiceinterview.application.shared.async.Timeouts;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.domain.connection.ConnectionFailureCause;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.session.SessionStatus;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Joins the real-time room for one descriptor: microphone probe, descriptor validation,
 * transport connect, microphone publish, advisory track check, backend notification.
 */
public class SessionConnector {
    private static final Logger log = Logger.getLogger(SessionConnector.class.getName());

    private final MicrophoneProbe microphoneProbe;
    private final RealtimeTransport transport;
    private final SessionStatusPort statusPort;
    private final ConnectionPolicy policy;
    private final EventLoop loop;
    private final Clock clock;

    public SessionConnector(MicrophoneProbe microphoneProbe,
                            RealtimeTransport transport,
                            SessionStatusPort statusPort,
                            ConnectionPolicy policy,
                            EventLoop loop,
                            Clock clock) {
        this.microphoneProbe = microphoneProbe;
        this.transport = transport;
        this.statusPort = statusPort;
        this.policy = policy;
        this.loop = loop;
        this.clock = clock;
    }

    public ConnectionAttempt connect(SessionDescriptor descriptor, RoomEventListener listener) {
        ConnectionAttempt attempt = new ConnectionAttempt();
        Executor executor = loop.asExecutor();
        attempt.track(Timeouts.within(microphoneProbe::probe, policy.microphoneProbeTimeout(), loop,
                        () -> new ConnectionFailure(ConnectionFailureCause.TIMEOUT,
                                "Microphone permission check timed out")))
                .thenComposeAsync(ignored -> {
                    attempt.ensureActive();
                    validate(descriptor);
                    RealtimeRoom room = transport.createRoom(listener);
                    attempt.bindRoom(room);
                    return attempt.track(Timeouts.within(
                            () -> room.connect(descriptor.transportUrl(), descriptor.token()),
                            policy.connectTimeout(), loop,
                            () -> new ConnectionFailure(ConnectionFailureCause.TIMEOUT, "Connection timeout")));
                }, executor)
                .thenComposeAsync(ignored -> {
                    RealtimeRoom room = attempt.requireRoom();
                    return attempt.track(Timeouts.within(room::enableMicrophone, policy.publishTimeout(), loop,
                            () -> new ConnectionFailure(ConnectionFailureCause.TIMEOUT,
                                    "Microphone setup timed out. Please check your microphone permissions and try again.")));
                }, executor)
                .thenComposeAsync(ignored -> attempt.track(Timeouts.delay(loop, policy.trackVerificationDelay())), executor)
                .thenAcceptAsync(ignored -> {
                    attempt.ensureActive();
                    verifyLocalAudio(descriptor, attempt.requireRoom());
                    notifyBackend(descriptor);
                }, executor)
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        attempt.succeed();
                    } else {
                        attempt.fail(ConnectionFailure.classify(error));
                    }
                });
        return attempt;
    }

    static void validate(SessionDescriptor descriptor) {
        String url = descriptor.transportUrl();
        if (url == null || url.isBlank()) {
            throw new ConnectionFailure(ConnectionFailureCause.MALFORMED_INPUT,
                    "Transport URL is missing from session data");
        }
        if (descriptor.token() == null || descriptor.token().isBlank()) {
            throw new ConnectionFailure(ConnectionFailureCause.MALFORMED_INPUT,
                    "Connection token is missing from session data");
        }
        try {
            URI uri = new URI(url.trim());
            if (!uri.isAbsolute() || uri.getScheme() == null || uri.getHost() == null) {
                throw new ConnectionFailure(ConnectionFailureCause.MALFORMED_INPUT,
                        "Invalid transport URL format: " + url);
            }
        } catch (URISyntaxException e) {
            throw new ConnectionFailure(ConnectionFailureCause.MALFORMED_INPUT,
                    "Invalid transport URL format: " + url, e);
        }
    }

    private void verifyLocalAudio(SessionDescriptor descriptor, RealtimeRoom room) {
        try {
            LocalAudioSnapshot snapshot = room.localAudio();
            if (snapshot == null || snapshot.audioTrackCount() == 0) {
                log.warning("connection.verify no_local_audio_track session=" + descriptor.sessionId().value());
            }
        } catch (RuntimeException e) {
            log.warning("connection.verify failure session=" + descriptor.sessionId().value()
                    + " reason=" + Timeouts.messageOf(e));
        }
    }

    private void notifyBackend(SessionDescriptor descriptor) {
        Timeouts.invoke(() -> statusPort.updateStatus(descriptor.sessionId(), SessionStatus.LIVE, clock.instant()))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warning("connection.notify failure session=" + descriptor.sessionId().value()
                                + " reason=" + Timeouts.messageOf(error));
                    }
                });
    }
}
