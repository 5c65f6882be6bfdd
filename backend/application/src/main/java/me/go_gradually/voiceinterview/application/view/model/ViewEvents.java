package me.go_gradually.voiceinterview.application.view.model;

public final class ViewEvents {
    public static final String SECTION_CHANGED = "section.changed";
    public static final String MESSAGE_SHOWN = "message.shown";
    public static final String MESSAGE_CLEARED = "message.cleared";
    public static final String CONNECTION_STATUS = "connection.status";
    public static final String SETUP_PROGRESS = "setup.progress";
    public static final String FORM_VALIDATED = "form.validated";
    public static final String INTERVIEW_PROGRESS = "interview.progress";
    public static final String AUDIO_LEVELS = "audio.levels";
    public static final String PARTICIPANT_JOINED = "participant.joined";
    public static final String TRACK_SUBSCRIBED = "track.subscribed";
    public static final String TRACK_UNSUBSCRIBED = "track.unsubscribed";
    public static final String CONNECTION_QUALITY = "connection.quality";
    public static final String REPORT_READY = "report.ready";
    public static final String SYSTEM_STATUS = "system.status";

    private ViewEvents() {
    }
}
