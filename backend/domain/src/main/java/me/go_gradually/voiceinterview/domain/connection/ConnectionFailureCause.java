package me.go_gradually.voiceinterview.domain.connection;

public enum ConnectionFailureCause {
    PERMISSION_DENIED(false,
            "Allow microphone access for this console, then try connecting again."),
    DEVICE_NOT_FOUND(false,
            "Check that a microphone is connected and selected as the input device, then try again."),
    MALFORMED_INPUT(false,
            "The session data is incomplete. Please restart the setup process."),
    TIMEOUT(true,
            "Check your internet connection and try again. Contact support if the issue persists."),
    TRANSPORT(true,
            "Check your internet connection and try again. Contact support if the issue persists."),
    GENERIC(false,
            "Try again, or restart the setup process if the problem continues.");

    private final boolean retryable;
    private final String remediation;

    ConnectionFailureCause(boolean retryable, String remediation) {
        this.retryable = retryable;
        this.remediation = remediation;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String remediation() {
        return remediation;
    }
}
