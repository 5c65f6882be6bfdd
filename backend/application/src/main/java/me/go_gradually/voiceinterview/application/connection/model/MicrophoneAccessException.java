package me.go_gradually.voiceinterview.application.connection.model;

public class MicrophoneAccessException extends RuntimeException {
    private final Kind kind;

    public MicrophoneAccessException(Kind kind, String message) {
        super(message);
        this.kind = kind == null ? Kind.OTHER : kind;
    }

    public MicrophoneAccessException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? Kind.OTHER : kind;
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        PERMISSION_DENIED,
        NOT_FOUND,
        OTHER
    }
}
