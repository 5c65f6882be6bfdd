package me.go_gradually.voiceinterview.application.connection.port;

import me.go_gradually.voiceinterview.application.connection.model.RoomEventListener;

public interface RealtimeTransport {
    RealtimeRoom createRoom(RoomEventListener listener);
}
