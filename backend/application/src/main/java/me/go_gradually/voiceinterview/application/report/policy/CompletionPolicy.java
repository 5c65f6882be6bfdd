package me.go_gradually.voiceinterview.application.report.policy;

import java.time.Duration;

public interface CompletionPolicy {
    Duration resultsDelay();
}
