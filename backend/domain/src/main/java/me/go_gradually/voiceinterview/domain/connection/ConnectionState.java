package me.go_gradually.voiceinterview.domain.connection;

import java.util.Locale;

public enum ConnectionState {
    IDLE,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    DISCONNECTED,
    ERROR;

    public boolean acceptsConnectRequest() {
        return this == IDLE || this == DISCONNECTED || this == ERROR;
    }

    public boolean isOnline() {
        return this == CONNECTED || this == RECONNECTING;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
