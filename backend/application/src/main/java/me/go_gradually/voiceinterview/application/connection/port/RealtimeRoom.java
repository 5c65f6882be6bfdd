package me.go_gradually.voiceinterview.application.connection.port;

import me.go_gradually.voiceinterview.application.connection.model.LocalAudioSnapshot;
import me.go_gradually.voiceinterview.application.connection.model.ParticipantLevel;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface RealtimeRoom {
    CompletableFuture<Void> connect(String url, String token);

    CompletableFuture<Void> enableMicrophone();

    LocalAudioSnapshot localAudio();

    List<ParticipantLevel> remoteAudioLevels();

    /**
     * Idempotent. No further events are delivered for a room the caller disconnected.
     */
    void disconnect();
}
