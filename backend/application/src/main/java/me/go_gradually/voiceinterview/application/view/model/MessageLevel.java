package me.go_gradually.voiceinterview.application.view.model;

import java.util.Locale;

public enum MessageLevel {
    SUCCESS,
    INFO,
    WARNING,
    DANGER;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
