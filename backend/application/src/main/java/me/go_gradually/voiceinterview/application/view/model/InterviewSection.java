package me.go_gradually.voiceinterview.application.view.model;

import java.util.Locale;

public enum InterviewSection {
    SETUP,
    PROCESSING,
    VOICE,
    RESULTS;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
