package me.go_gradually.voiceinterview.application.connection.model;

public record RoomEvent(RoomEventType type,
                        String participantIdentity,
                        boolean local,
                        TrackKind trackKind,
                        ConnectionQuality quality,
                        String reason) {
    public RoomEvent {
        if (type == null) {
            throw new IllegalArgumentException("Room event type is required");
        }
    }

    public static RoomEvent participantConnected(String identity) {
        return new RoomEvent(RoomEventType.PARTICIPANT_CONNECTED, identity, false, null, null, null);
    }

    public static RoomEvent participantDisconnected(String identity) {
        return new RoomEvent(RoomEventType.PARTICIPANT_DISCONNECTED, identity, false, null, null, null);
    }

    public static RoomEvent trackSubscribed(String identity, TrackKind kind) {
        return new RoomEvent(RoomEventType.TRACK_SUBSCRIBED, identity, false, kind, null, null);
    }

    public static RoomEvent trackUnsubscribed(String identity, TrackKind kind) {
        return new RoomEvent(RoomEventType.TRACK_UNSUBSCRIBED, identity, false, kind, null, null);
    }

    public static RoomEvent disconnected(String reason) {
        return new RoomEvent(RoomEventType.DISCONNECTED, null, true, null, null, reason);
    }

    public static RoomEvent reconnecting() {
        return new RoomEvent(RoomEventType.RECONNECTING, null, true, null, null, null);
    }

    public static RoomEvent reconnected() {
        return new RoomEvent(RoomEventType.RECONNECTED, null, true, null, null, null);
    }

    public static RoomEvent qualityChanged(String identity, boolean local, ConnectionQuality quality) {
        return new RoomEvent(RoomEventType.CONNECTION_QUALITY_CHANGED, identity, local, null, quality, null);
    }
}
