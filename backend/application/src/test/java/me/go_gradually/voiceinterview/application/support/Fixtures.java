package me.go_gradually.voiceinterview.application.support;

import me.go_gradually.voiceinterview.domain.form.Attachment;
import me.go_gradually.voiceinterview.domain.session.SessionDescriptor;
import me.go_gradually.voiceinterview.domain.session.SessionId;

import java.time.Instant;
import java.util.List;

public final class Fixtures {
    public static final String CANDIDATE = "Jane Doe";
    public static final String INTERVIEWER = "interview-agent";

    private Fixtures() {
    }

    public static SessionDescriptor descriptor() {
        return descriptor("wss://rt.example.com", "token-1");
    }

    public static SessionDescriptor descriptor(String url, String token) {
        return new SessionDescriptor(SessionId.of("session-0123456789"), CANDIDATE,
                List.of("q1", "q2", "q3", "q4", "q5", "q6"), url, token, "room-1", Instant.parse("2026-01-01T00:00:00Z"));
    }

    public static Attachment jobDescription() {
        return Attachment.of("jd.txt", "text/plain", "Backend engineer, Java".getBytes());
    }

    public static Attachment resume() {
        return Attachment.of("resume.txt", "text/plain", "Ten years of Java".getBytes());
    }
}
