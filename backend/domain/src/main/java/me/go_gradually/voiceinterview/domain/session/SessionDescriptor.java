package me.go_gradually.voiceinterview.domain.session;

import java.time.Instant;
import java.util.List;

/**
 * Everything needed to join and later reconcile one interview session.
 * Transport URL and token are not validated here; the connector rejects malformed values at connect time.
 */
public record SessionDescriptor(SessionId sessionId,
                                String candidateName,
                                List<String> questions,
                                String transportUrl,
                                String token,
                                String roomName,
                                Instant createdAt) {
    public SessionDescriptor {
        if (sessionId == null) {
            throw new IllegalArgumentException("SessionId is required");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Created time is required");
        }
        candidateName = candidateName == null ? "" : candidateName;
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public int questionCount() {
        return questions.size();
    }
}
