package me.go_gradually.voiceinterview.application.setup.model;

import java.util.Map;

public record AnalysisResult(boolean success, Map<String, Object> analysis, String error) implements StepResult {
    public AnalysisResult {
        analysis = analysis == null ? Map.of() : analysis;
    }

    public static AnalysisResult succeeded(Map<String, Object> analysis) {
        return new AnalysisResult(true, analysis, null);
    }

    public static AnalysisResult failed(String error) {
        return new AnalysisResult(false, null, error);
    }
}
