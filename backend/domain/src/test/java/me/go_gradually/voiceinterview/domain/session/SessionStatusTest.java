package me.go_gradually.voiceinterview.domain.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStatusTest {

    @Test
    void fromCode_mapsLiveAliases() {
        assertEquals(SessionStatus.LIVE, SessionStatus.fromCode("in-progress"));
        assertEquals(SessionStatus.LIVE, SessionStatus.fromCode("active"));
        assertEquals(SessionStatus.LIVE, SessionStatus.fromCode("interviewing"));
        assertEquals(SessionStatus.LIVE, SessionStatus.fromCode("IN_PROGRESS"));
    }

    @Test
    void fromCode_mapsFailureAliases() {
        assertEquals(SessionStatus.FAILED, SessionStatus.fromCode("failed"));
        assertEquals(SessionStatus.FAILED, SessionStatus.fromCode("error"));
    }

    @Test
    void fromCode_returnsUnknownForMissingOrUnrecognisedValues() {
        assertEquals(SessionStatus.UNKNOWN, SessionStatus.fromCode(null));
        assertEquals(SessionStatus.UNKNOWN, SessionStatus.fromCode(" "));
        assertEquals(SessionStatus.UNKNOWN, SessionStatus.fromCode("paused"));
    }

    @Test
    void terminalStatuses_areCompletedDisconnectedAndFailed() {
        assertTrue(SessionStatus.COMPLETED.isTerminal());
        assertTrue(SessionStatus.DISCONNECTED.isTerminal());
        assertTrue(SessionStatus.FAILED.isTerminal());
        assertFalse(SessionStatus.LIVE.isTerminal());
        assertFalse(SessionStatus.UNKNOWN.isTerminal());
        assertFalse(SessionStatus.UNKNOWN.isLive());
    }
}
