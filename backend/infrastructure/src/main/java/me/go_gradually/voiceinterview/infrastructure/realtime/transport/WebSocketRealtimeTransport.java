package me.go_gradually.voiceinterview.infrastructure.realtime.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voiceinterview.application.connection.model.RoomEventListener;
import me.go_gradually.voiceinterview.application.connection.port.RealtimeRoom;
import me.go_gradually.voiceinterview.application.connection.port.RealtimeTransport;
import me.go_gradually.voiceinterview.infrastructure.realtime.audio.AudioLineSource;
import me.go_gradually.voiceinterview.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Executor;

@Component
public class WebSocketRealtimeTransport implements RealtimeTransport {
    private final HttpClient httpClient;
    private final RoomSignalCodec codec = new RoomSignalCodec(new ObjectMapper());
    private final AudioLineSource lineSource;
    private final AppProperties properties;
    private final Executor audioExecutor;

    @Autowired
    public WebSocketRealtimeTransport(AudioLineSource lineSource,
                                      AppProperties properties,
                                      @Qualifier("audioExecutor") Executor audioExecutor) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                lineSource, properties, audioExecutor);
    }

    WebSocketRealtimeTransport(HttpClient httpClient,
                               AudioLineSource lineSource,
                               AppProperties properties,
                               Executor audioExecutor) {
        this.httpClient = httpClient;
        this.lineSource = lineSource;
        this.properties = properties;
        this.audioExecutor = audioExecutor;
    }

    @Override
    public RealtimeRoom createRoom(RoomEventListener listener) {
        return new WebSocketRealtimeRoom(httpClient, codec, lineSource, properties.getAudio(), audioExecutor, listener);
    }
}
