package me.go_gradually.voiceinterview.domain.setup;

public record SetupProgress(int percent, String label, String detail) {
    public SetupProgress {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent must be between 0 and 100");
        }
    }

    public static SetupProgress started() {
        return new SetupProgress(10, "Uploading files...", "Preparing documents for analysis");
    }
}
