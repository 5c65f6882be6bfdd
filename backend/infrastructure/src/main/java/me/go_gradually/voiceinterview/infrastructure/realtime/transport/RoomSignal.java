package me.go_gradually.voiceinterview.infrastructure.realtime.transport;

import me.go_gradually.voiceinterview.application.connection.model.ParticipantLevel;
import me.go_gradually.voiceinterview.application.connection.model.RoomEvent;

/**
 * One decoded signalling frame: either a room event or a remote audio level update.
 */
public record RoomSignal(RoomEvent event, ParticipantLevel level) {
    public static RoomSignal of(RoomEvent event) {
        return new RoomSignal(event, null);
    }

    public static RoomSignal of(ParticipantLevel level) {
        return new RoomSignal(null, level);
    }

    public boolean isLevel() {
        return level != null;
    }
}
