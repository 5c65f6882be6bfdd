package me.go_gradually.voiceinterview.presentation.interview.dto;

public class InterviewStateResponse {
    private String connectionState;
    private String sessionId;
    private String sessionStatus;
    private int connectionAttempts;
    private boolean reconciling;
    private boolean reportAvailable;

    public String getConnectionState() {
        return connectionState;
    }

    public void setConnectionState(String connectionState) {
        this.connectionState = connectionState;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionStatus() {
        return sessionStatus;
    }

    public void setSessionStatus(String sessionStatus) {
        this.sessionStatus = sessionStatus;
    }

    public int getConnectionAttempts() {
        return connectionAttempts;
    }

    public void setConnectionAttempts(int connectionAttempts) {
        this.connectionAttempts = connectionAttempts;
    }

    public boolean isReconciling() {
        return reconciling;
    }

    public void setReconciling(boolean reconciling) {
        this.reconciling = reconciling;
    }

    public boolean isReportAvailable() {
        return reportAvailable;
    }

    public void setReportAvailable(boolean reportAvailable) {
        this.reportAvailable = reportAvailable;
    }
}
