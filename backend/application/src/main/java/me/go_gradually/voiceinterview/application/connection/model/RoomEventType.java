package me.go_gradually.voiceinterview.application.connection.model;

public enum RoomEventType {
    PARTICIPANT_CONNECTED,
    PARTICIPANT_DISCONNECTED,
    TRACK_SUBSCRIBED,
    TRACK_UNSUBSCRIBED,
    DISCONNECTED,
    RECONNECTING,
    RECONNECTED,
    CONNECTION_QUALITY_CHANGED
}
