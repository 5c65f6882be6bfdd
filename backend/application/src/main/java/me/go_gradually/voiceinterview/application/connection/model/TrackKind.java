package me.go_gradually.voiceinterview.application.connection.model;

import java.util.Locale;

public enum TrackKind {
    AUDIO,
    VIDEO,
    UNKNOWN;

    public static TrackKind fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "audio" -> AUDIO;
            case "video" -> VIDEO;
            default -> UNKNOWN;
        };
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
