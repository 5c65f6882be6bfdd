package me.go_gradually.voiceinterview.application.view.usecase;

import me.go_gradually.voiceinterview.application.connection.model.ConnectionQuality;
import me.go_gradually.voiceinterview.application.connection.model.TrackKind;
import me.go_gradually.voiceinterview.application.view.model.InterviewEventSink;
import me.go_gradually.voiceinterview.application.view.model.InterviewSection;
import me.go_gradually.voiceinterview.application.view.model.MessageArea;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.application.view.model.ViewEvents;
import me.go_gradually.voiceinterview.domain.connection.ConnectionState;
import me.go_gradually.voiceinterview.domain.form.FormValidation;
import me.go_gradually.voiceinterview.domain.report.ReportDocument;
import me.go_gradually.voiceinterview.domain.setup.SetupProgress;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.logging.Logger;

/**
 * Turns orchestration outcomes into named view events and fans them out to every registered sink.
 * State-like events are retained and replayed to sinks that register later.
 */
public class InterviewView {
    private static final Logger log = Logger.getLogger(InterviewView.class.getName());

    private final Set<InterviewEventSink> sinks = new CopyOnWriteArraySet<>();
    private final Map<String, RetainedEvent> retained = new ConcurrentHashMap<>();

    public void register(InterviewEventSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink is required");
        }
        sinks.add(sink);
        for (RetainedEvent event : retained.values()) {
            if (!sink.send(event.name(), event.payload())) {
                sinks.remove(sink);
                return;
            }
        }
    }

    public void unregister(InterviewEventSink sink) {
        sinks.remove(sink);
    }

    public int sinkCount() {
        return sinks.size();
    }

    public void showSection(InterviewSection section) {
        publishRetained(ViewEvents.SECTION_CHANGED, ViewEvents.SECTION_CHANGED, Map.of("section", section.code()));
    }

    public void showMessage(MessageArea area, MessageLevel level, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("area", area.code());
        payload.put("level", level.code());
        payload.put("text", text == null ? "" : text);
        publishRetained(messageKey(area), ViewEvents.MESSAGE_SHOWN, payload);
    }

    public void clearMessage(MessageArea area) {
        retained.remove(messageKey(area));
        publish(ViewEvents.MESSAGE_CLEARED, Map.of("area", area.code()));
    }

    public void clearAllMessages() {
        for (MessageArea area : MessageArea.values()) {
            clearMessage(area);
        }
    }

    public void connectionStatus(ConnectionState state, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("state", state.code());
        payload.put("text", text == null ? "" : text);
        publishRetained(ViewEvents.CONNECTION_STATUS, ViewEvents.CONNECTION_STATUS, payload);
    }

    public void setupProgress(SetupProgress progress) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("percent", progress.percent());
        payload.put("label", progress.label());
        payload.put("detail", progress.detail());
        publishRetained(ViewEvents.SETUP_PROGRESS, ViewEvents.SETUP_PROGRESS, payload);
    }

    public void formValidated(FormValidation validation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("valid", validation.valid());
        payload.put("submitHint", validation.submitHint());
        payload.put("problems", validation.problems());
        publishRetained(ViewEvents.FORM_VALIDATED, ViewEvents.FORM_VALIDATED, payload);
    }

    public void interviewProgress(int current, int total) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("current", current);
        payload.put("total", total);
        publishRetained(ViewEvents.INTERVIEW_PROGRESS, ViewEvents.INTERVIEW_PROGRESS, payload);
    }

    public void audioLevels(int microphone, int interviewer) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("microphone", microphone);
        payload.put("interviewer", interviewer);
        publish(ViewEvents.AUDIO_LEVELS, payload);
    }

    public void participantJoined(String identity) {
        publish(ViewEvents.PARTICIPANT_JOINED, Map.of("identity", identity));
    }

    public void trackSubscribed(String identity, TrackKind kind) {
        publish(ViewEvents.TRACK_SUBSCRIBED, Map.of("identity", identity, "kind", kind.code()));
    }

    public void trackUnsubscribed(String identity, TrackKind kind) {
        publish(ViewEvents.TRACK_UNSUBSCRIBED, Map.of("identity", identity, "kind", kind.code()));
    }

    public void connectionQuality(ConnectionQuality quality) {
        publish(ViewEvents.CONNECTION_QUALITY, Map.of("quality", quality.code()));
    }

    public void reportReady(ReportDocument document) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("fileName", document.fileName());
        payload.put("contentType", document.contentType());
        payload.put("size", document.size());
        publishRetained(ViewEvents.REPORT_READY, ViewEvents.REPORT_READY, payload);
    }

    public void clearReport() {
        retained.remove(ViewEvents.REPORT_READY);
    }

    public void systemStatus(MessageLevel level, String title, String detail) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("level", level.code());
        payload.put("title", title);
        payload.put("detail", detail);
        publishRetained(ViewEvents.SYSTEM_STATUS, ViewEvents.SYSTEM_STATUS, payload);
    }

    private void publishRetained(String key, String event, Map<String, Object> payload) {
        retained.put(key, new RetainedEvent(event, payload));
        publish(event, payload);
    }

    private void publish(String event, Map<String, Object> payload) {
        for (InterviewEventSink sink : sinks) {
            boolean delivered;
            try {
                delivered = sink.send(event, payload);
            } catch (RuntimeException e) {
                log.fine(() -> "interview.view.sink failure event=" + event + " reason=" + e.getMessage());
                delivered = false;
            }
            if (!delivered) {
                sinks.remove(sink);
            }
        }
    }

    private static String messageKey(MessageArea area) {
        return ViewEvents.MESSAGE_SHOWN + ":" + area.code();
    }

    private record RetainedEvent(String name, Map<String, Object> payload) {
    }
}
