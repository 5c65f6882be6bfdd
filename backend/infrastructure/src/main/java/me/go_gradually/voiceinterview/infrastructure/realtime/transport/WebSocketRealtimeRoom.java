package me.go_gradually.voiceinterview.infrastructure.realtime.transport;

import me.go_gradually.voiceinterview.application.connection.model.LocalAudioSnapshot;
import me.go_gradually.voiceinterview.application.connection.model.ParticipantLevel;
import me.go_gradually.voiceinterview.application.connection.model.RoomEvent;
import me.go_gradually.voiceinterview.application.connection.model.RoomEventListener;
import me.go_gradually.voiceinterview.application.connection.model.RoomEventType;
import me.go_gradually.voiceinterview.application.connection.model.TrackKind;
import me.go_gradually.voiceinterview.application.connection.port.RealtimeRoom;
import me.go_gradually.voiceinterview.infrastructure.realtime.audio.AudioLineSource;
import me.go_gradually.voiceinterview.infrastructure.realtime.audio.MicrophoneCapture;
import me.go_gradually.voiceinterview.infrastructure.shared.config.AppProperties;

import javax.sound.sampled.TargetDataLine;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * One room join over a signalling WebSocket. Server events arrive as JSON text frames;
 * captured microphone audio leaves as binary PCM frames.
 */
class WebSocketRealtimeRoom implements RealtimeRoom {
    private static final Logger log = Logger.getLogger(WebSocketRealtimeRoom.class.getName());
    private static final String MICROPHONE_SOURCE = "microphone";

    private final HttpClient httpClient;
    private final RoomSignalCodec codec;
    private final AudioLineSource lineSource;
    private final AppProperties.Audio audio;
    private final Executor audioExecutor;
    private final RoomEventListener listener;
    private final Map<String, Double> remoteLevels = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile WebSocket webSocket;
    private volatile MicrophoneCapture capture;
    private CompletableFuture<Void> sendChain = CompletableFuture.completedFuture(null);

    WebSocketRealtimeRoom(HttpClient httpClient,
                          RoomSignalCodec codec,
                          AudioLineSource lineSource,
                          AppProperties.Audio audio,
                          Executor audioExecutor,
                          RoomEventListener listener) {
        this.httpClient = httpClient;
        this.codec = codec;
        this.lineSource = lineSource;
        this.audio = audio;
        this.audioExecutor = audioExecutor;
        this.listener = listener;
    }

    static URI signallingUri(String url, String token) {
        String base = url.trim();
        String separator = base.contains("?") ? "&" : "?";
        return URI.create(base + separator + "access_token=" + URLEncoder.encode(token, StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<Void> connect(String url, String token) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Room was disconnected"));
        }
        URI uri;
        try {
            uri = signallingUri(url, token);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return httpClient.newWebSocketBuilder()
                .buildAsync(uri, new SignalListener())
                .thenAccept(socket -> {
                    if (closed.get()) {
                        socket.abort();
                        throw new IllegalStateException("Room was disconnected");
                    }
                    webSocket = socket;
                    log.info(() -> "room.connect ok host=" + uri.getHost());
                });
    }

    @Override
    public CompletableFuture<Void> enableMicrophone() {
        if (webSocket == null || closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Room is not connected"));
        }
        return CompletableFuture.supplyAsync(() -> lineSource.open(MicrophoneCapture.formatOf(audio)), audioExecutor)
                .thenCompose(line -> publish(line));
    }

    private CompletableFuture<Void> publish(TargetDataLine line) {
        MicrophoneCapture published = new MicrophoneCapture(line, MicrophoneCapture.frameBytesOf(audio), this::sendAudioFrame);
        // publish before checking closed so a concurrent disconnect always sees the capture
        capture = published;
        if (closed.get()) {
            published.stop();
            return CompletableFuture.failedFuture(new IllegalStateException("Room was disconnected"));
        }
        return send(socket -> socket.sendText(codec.encodeTrackPublished(TrackKind.AUDIO, MICROPHONE_SOURCE), true))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        published.stop();
                    }
                })
                .thenRun(() -> published.start(audioExecutor));
    }

    @Override
    public LocalAudioSnapshot localAudio() {
        MicrophoneCapture current = capture;
        if (current == null || !current.isRunning()) {
            return LocalAudioSnapshot.silent();
        }
        return new LocalAudioSnapshot(1, current.level());
    }

    @Override
    public List<ParticipantLevel> remoteAudioLevels() {
        return remoteLevels.entrySet().stream()
                .map(entry -> new ParticipantLevel(entry.getKey(), entry.getValue()))
                .toList();
    }

    @Override
    public void disconnect() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stopCapture();
        remoteLevels.clear();
        WebSocket socket = webSocket;
        if (socket == null) {
            return;
        }
        socket.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect").whenComplete((ignored, error) -> {
            if (error != null) {
                log.fine(() -> "room.disconnect close_failed reason=" + error.getMessage());
                socket.abort();
            }
        });
    }

    private void sendAudioFrame(byte[] frame) {
        send(socket -> socket.sendBinary(ByteBuffer.wrap(frame), true));
    }

    private synchronized CompletableFuture<Void> send(Function<WebSocket, CompletableFuture<WebSocket>> frame) {
        WebSocket socket = webSocket;
        if (socket == null || closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Room is not connected"));
        }
        CompletableFuture<Void> next = sendChain
                .handle((ignored, error) -> socket)
                .thenCompose(frame)
                .thenApply(ignored -> null);
        sendChain = next;
        return next;
    }

    private void stopCapture() {
        MicrophoneCapture current = capture;
        if (current != null) {
            current.stop();
        }
    }

    private void dispatch(RoomSignal signal) {
        if (closed.get()) {
            return;
        }
        if (signal.isLevel()) {
            remoteLevels.put(signal.level().identity(), signal.level().level());
            return;
        }
        RoomEvent event = signal.event();
        if (event.type() == RoomEventType.DISCONNECTED) {
            terminate(event.reason());
            return;
        }
        if (event.type() == RoomEventType.PARTICIPANT_DISCONNECTED && event.participantIdentity() != null) {
            remoteLevels.remove(event.participantIdentity());
        }
        deliver(event);
    }

    private void terminate(String reason) {
        if (closed.get() || !terminated.compareAndSet(false, true)) {
            return;
        }
        stopCapture();
        remoteLevels.clear();
        deliver(RoomEvent.disconnected(reason));
    }

    private void deliver(RoomEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warning("room.event listener_failure type=" + event.type() + " reason=" + e.getMessage());
        }
    }

    private final class SignalListener implements WebSocket.Listener {
        private final StringBuilder textBuffer = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String payload = textBuffer.toString();
                textBuffer.setLength(0);
                codec.decode(payload).ifPresent(WebSocketRealtimeRoom.this::dispatch);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            terminate(reason == null || reason.isBlank() ? "closed with status " + statusCode : reason);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            terminate(error == null || error.getMessage() == null ? "signalling error" : error.getMessage());
        }
    }
}
