package me.go_gradually.voiceinterview.application.connection.model;

public record LocalAudioSnapshot(int audioTrackCount, double level) {
    public static LocalAudioSnapshot silent() {
        return new LocalAudioSnapshot(0, 0.0);
    }
}
