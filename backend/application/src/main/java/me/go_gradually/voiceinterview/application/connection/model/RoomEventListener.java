package me.go_gradually.voiceinterview.application.connection.model;

@FunctionalInterface
public interface RoomEventListener {
    void onEvent(RoomEvent event);
}
