package me.go_gradually.voiceinterview.infrastructure.realtime.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voiceinterview.application.connection.model.ConnectionQuality;
import me.go_gradually.voiceinterview.application.connection.model.ParticipantLevel;
import me.go_gradually.voiceinterview.application.connection.model.RoomEvent;
import me.go_gradually.voiceinterview.application.connection.model.TrackKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * JSON signalling frames exchanged with the room server.
 */
public class RoomSignalCodec {
    private static final Logger log = Logger.getLogger(RoomSignalCodec.class.getName());

    private final ObjectMapper objectMapper;

    public RoomSignalCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Unknown frame types and malformed JSON decode to empty.
     */
    public Optional<RoomSignal> decode(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warning("room.signal malformed reason=" + e.getOriginalMessage());
            return Optional.empty();
        }
        String type = root.path("type").asText("");
        String identity = root.path("identity").asText("");
        return switch (type) {
            case "participant_connected" -> Optional.of(RoomSignal.of(RoomEvent.participantConnected(identity)));
            case "participant_disconnected" -> Optional.of(RoomSignal.of(RoomEvent.participantDisconnected(identity)));
            case "track_subscribed" -> Optional.of(RoomSignal.of(
                    RoomEvent.trackSubscribed(identity, TrackKind.fromCode(root.path("kind").asText(null)))));
            case "track_unsubscribed" -> Optional.of(RoomSignal.of(
                    RoomEvent.trackUnsubscribed(identity, TrackKind.fromCode(root.path("kind").asText(null)))));
            case "reconnecting" -> Optional.of(RoomSignal.of(RoomEvent.reconnecting()));
            case "reconnected" -> Optional.of(RoomSignal.of(RoomEvent.reconnected()));
            case "connection_quality_changed" -> Optional.of(RoomSignal.of(RoomEvent.qualityChanged(identity,
                    root.path("local").asBoolean(false),
                    ConnectionQuality.fromCode(root.path("quality").asText(null)))));
            case "audio_level" -> Optional.of(RoomSignal.of(
                    new ParticipantLevel(identity, clamp(root.path("level").asDouble(0.0)))));
            case "disconnected" -> Optional.of(RoomSignal.of(RoomEvent.disconnected(root.path("reason").asText("server"))));
            default -> {
                log.fine(() -> "room.signal ignored type=" + type);
                yield Optional.empty();
            }
        };
    }

    public String encodeTrackPublished(TrackKind kind, String source) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "track_published");
        frame.put("kind", kind.code());
        frame.put("source", source);
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode room signal", e);
        }
    }

    private static double clamp(double level) {
        if (Double.isNaN(level) || level < 0) {
            return 0.0;
        }
        return Math.min(1.0, level);
    }
}
