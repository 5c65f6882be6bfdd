package me.go_gradually.voiceinterview.application.report.model;

public record ReportDispatchResult(boolean success, String message) {
}
