package me.go_gradually.voiceinterview.domain.report;

public enum ReportDispatchOutcome {
    SENT,
    REJECTED,
    UNREACHABLE
}
