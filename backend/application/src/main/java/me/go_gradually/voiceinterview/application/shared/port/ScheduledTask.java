package me.go_gradually.voiceinterview.application.shared.port;

public interface ScheduledTask {
    void cancel();

    boolean isCancelled();

    static void cancelIfPresent(ScheduledTask task) {
        if (task != null) {
            task.cancel();
        }
    }
}
