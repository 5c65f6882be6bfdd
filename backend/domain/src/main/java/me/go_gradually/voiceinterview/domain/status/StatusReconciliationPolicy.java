package me.go_gradually.voiceinterview.domain.status;

import me.go_gradually.voiceinterview.domain.session.SessionStatus;

public final class StatusReconciliationPolicy {
    private StatusReconciliationPolicy() {
    }

    public static ReconciliationAction decide(SessionStatus status) {
        if (status == null) {
            return ReconciliationAction.KEEP_POLLING;
        }
        return switch (status) {
            case COMPLETED -> ReconciliationAction.DISPATCH_REPORT;
            case DISCONNECTED -> ReconciliationAction.END_WITHOUT_REPORT;
            case FAILED -> ReconciliationAction.FAIL;
            default -> ReconciliationAction.KEEP_POLLING;
        };
    }

    public enum ReconciliationAction {
        DISPATCH_REPORT,
        END_WITHOUT_REPORT,
        FAIL,
        KEEP_POLLING;

        public boolean stopsPolling() {
            return this != KEEP_POLLING;
        }
    }
}
