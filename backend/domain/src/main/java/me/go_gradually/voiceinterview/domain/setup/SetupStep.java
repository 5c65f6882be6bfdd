package me.go_gradually.voiceinterview.domain.setup;

public enum SetupStep {
    UPLOAD("upload", "File upload timed out. Please try again with smaller files.",
            new SetupProgress(30, "Analyzing documents...", "AI is analyzing job requirements and candidate profile")),
    ANALYZE("analyze", "Document analysis timed out. Please try again.",
            new SetupProgress(60, "Generating questions...", "Creating personalized interview questions")),
    GENERATE_QUESTIONS("generate_questions", "Question generation timed out. Please try again.",
            new SetupProgress(80, "Creating interview session...", "Setting up voice interview room")),
    CREATE_SESSION("create_session", "Session creation timed out. Please try again.",
            new SetupProgress(100, "Setup complete!", "Ready to start voice interview"));

    private final String code;
    private final String timeoutMessage;
    private final SetupProgress completedProgress;

    SetupStep(String code, String timeoutMessage, SetupProgress completedProgress) {
        this.code = code;
        this.timeoutMessage = timeoutMessage;
        this.completedProgress = completedProgress;
    }

    public String code() {
        return code;
    }

    public String timeoutMessage() {
        return timeoutMessage;
    }

    public SetupProgress completedProgress() {
        return completedProgress;
    }
}
