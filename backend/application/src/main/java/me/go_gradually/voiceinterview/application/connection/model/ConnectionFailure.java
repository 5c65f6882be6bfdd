package me.go_gradually.voiceinterview.application.connection.model;

import me.go_gradually.voiceinterview.application.shared.async.Timeouts;
import me.go_gradually.voiceinterview.domain.connection.ConnectionFailureCause;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

public class ConnectionFailure extends RuntimeException {
    private static final List<String> TRANSPORT_MARKERS = List.of(
            "connection timeout",
            "network error",
            "websocket connection failed",
            "failed to connect"
    );

    private final ConnectionFailureCause failureCause;

    public ConnectionFailure(ConnectionFailureCause failureCause, String message) {
        super(message);
        this.failureCause = failureCause;
    }

    public ConnectionFailure(ConnectionFailureCause failureCause, String message, Throwable cause) {
        super(message, cause);
        this.failureCause = failureCause;
    }

    public ConnectionFailureCause failureCause() {
        return failureCause;
    }

    public boolean isRetryable() {
        return failureCause.isRetryable();
    }

    public String userMessage() {
        return "Failed to connect: " + getMessage() + "\n\n" + failureCause.remediation();
    }

    public static ConnectionFailure classify(Throwable error) {
        Throwable cause = Timeouts.unwrap(error);
        if (cause instanceof ConnectionFailure failure) {
            return failure;
        }
        if (cause instanceof MicrophoneAccessException microphone) {
            return fromMicrophone(microphone);
        }
        if (cause instanceof TimeoutException) {
            return new ConnectionFailure(ConnectionFailureCause.TIMEOUT, "Connection timeout", cause);
        }
        String message = Timeouts.messageOf(cause);
        if (cause instanceof IOException || mentionsTransport(message)) {
            return new ConnectionFailure(ConnectionFailureCause.TRANSPORT, message, cause);
        }
        return new ConnectionFailure(ConnectionFailureCause.GENERIC, message, cause);
    }

    private static ConnectionFailure fromMicrophone(MicrophoneAccessException microphone) {
        return switch (microphone.kind()) {
            case PERMISSION_DENIED -> new ConnectionFailure(ConnectionFailureCause.PERMISSION_DENIED,
                    "Microphone access denied. Please enable microphone permissions and refresh the page.", microphone);
            case NOT_FOUND -> new ConnectionFailure(ConnectionFailureCause.DEVICE_NOT_FOUND,
                    "No microphone found. Please connect a microphone and try again.", microphone);
            case OTHER -> new ConnectionFailure(ConnectionFailureCause.GENERIC,
                    "Microphone error: " + Timeouts.messageOf(microphone), microphone);
        };
    }

    private static boolean mentionsTransport(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : TRANSPORT_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
