package me.go_gradually.voiceinterview.application.status.model;

import me.go_gradually.voiceinterview.domain.session.SessionStatus;

public interface ReconciliationListener {
    void onResolved(SessionStatus status);

    void onGaveUp();
}
