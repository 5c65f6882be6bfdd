package me.go_gradually.voiceinterview.application.connection.model;

import java.util.Locale;

public enum ConnectionQuality {
    EXCELLENT,
    GOOD,
    POOR,
    LOST,
    UNKNOWN;

    public static ConnectionQuality fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
