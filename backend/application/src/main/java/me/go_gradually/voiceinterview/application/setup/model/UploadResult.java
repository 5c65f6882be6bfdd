package me.go_gradually.voiceinterview.application.setup.model;

public record UploadResult(boolean success, String jobDescriptionText, String resumeText, String error)
        implements StepResult {
    public static UploadResult succeeded(String jobDescriptionText, String resumeText) {
        return new UploadResult(true, jobDescriptionText, resumeText, null);
    }

    public static UploadResult failed(String error) {
        return new UploadResult(false, null, null, error);
    }
}
