package me.go_gradually.voiceinterview.application.status.model;

import me.go_gradually.voiceinterview.application.shared.port.ScheduledTask;

public interface ReconciliationHandle extends ScheduledTask {
    boolean isFinished();

    int attempts();
}
