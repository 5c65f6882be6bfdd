package me.go_gradually.voiceinterview.application.view.model;

@FunctionalInterface
public interface InterviewEventSink {
    /**
     * @return false when the sink is closed and should be dropped
     */
    boolean send(String event, Object payload);
}
