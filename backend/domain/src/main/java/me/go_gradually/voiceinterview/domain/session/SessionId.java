package me.go_gradually.voiceinterview.domain.session;

public record SessionId(String value) {
    private static final int SHORT_LENGTH = 8;

    public SessionId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId is required");
        }
    }

    public static SessionId of(String value) {
        return new SessionId(value);
    }

    public String shortValue() {
        return value.length() <= SHORT_LENGTH ? value : value.substring(0, SHORT_LENGTH);
    }
}
