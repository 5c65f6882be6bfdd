package me.go_gradually.voiceinterview.application.connection.port;

import java.util.concurrent.CompletableFuture;

public interface MicrophoneProbe {
    /**
     * Opens and immediately releases the capture device. Fails with
     * {@link me.go_gradually.voiceinterview.application.connection.model.MicrophoneAccessException}.
     */
    CompletableFuture<Void> probe();
}
