package me.go_gradually.voiceinterview.domain.session;

import java.util.List;
import java.util.Locale;

public enum SessionStatus {
    CREATED("created"),
    READY("ready"),
    LIVE("in-progress", "active", "interviewing"),
    COMPLETED("completed"),
    DISCONNECTED("disconnected"),
    FAILED("failed", "error"),
    UNKNOWN("unknown");

    private final List<String> codes;

    SessionStatus(String... codes) {
        this.codes = List.of(codes);
    }

    public static SessionStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SessionStatus status : values()) {
            if (status.codes.contains(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }

    public String code() {
        return codes.get(0);
    }

    public boolean isLive() {
        return this == LIVE;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DISCONNECTED || this == FAILED;
    }
}
