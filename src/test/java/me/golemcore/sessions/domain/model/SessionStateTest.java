package me.golemcore.sessions.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStateTest {

    private static final Instant CREATED = Instant.parse("2026-01-15T10:00:00Z");
    private static final Instant LATER = Instant.parse("2026-01-15T10:05:00Z");

    private static SessionState stateIn(SessionStatus status) {
        SessionState state = SessionState.initializing("session_1", null, null, null, CREATED);
        state.setStatus(status);
        return state;
    }

    @Test
    void shouldAllowOnlyDefinedTransitions() {
        Map<SessionStatus, Set<SessionStatus>> allowed = Map.of(
                SessionStatus.INITIALIZING, EnumSet.of(SessionStatus.ACTIVE, SessionStatus.TERMINATED),
                SessionStatus.ACTIVE, EnumSet.of(SessionStatus.IDLE, SessionStatus.TERMINATING),
                SessionStatus.IDLE, EnumSet.of(SessionStatus.ACTIVE, SessionStatus.TERMINATING),
                SessionStatus.TERMINATING, EnumSet.of(SessionStatus.TERMINATED),
                SessionStatus.TERMINATED, EnumSet.noneOf(SessionStatus.class));

        for (SessionStatus from : SessionStatus.values()) {
            for (SessionStatus to : SessionStatus.values()) {
                SessionState state = stateIn(from);
                Result<SessionStatus> result = state.transitionTo(to, LATER);
                if (allowed.get(from).contains(to)) {
                    assertTrue(result.isSuccess(), from + " -> " + to);
                    assertEquals(from, result.getValue());
                    assertEquals(to, state.getStatus());
                    assertEquals(LATER, state.getUpdatedAt());
                } else {
                    assertEquals(ErrorCode.INVALID_TRANSITION, result.getErrorCode(), from + " -> " + to);
                    assertEquals(from, state.getStatus());
                    assertEquals(CREATED, state.getUpdatedAt());
                }
            }
        }
    }

    @Test
    void shouldDescribeRejectedTransition() {
        Result<SessionStatus> result = stateIn(SessionStatus.TERMINATED).transitionTo(SessionStatus.ACTIVE, LATER);

        assertEquals("terminated", result.getDetails().get("from"));
        assertEquals("active", result.getDetails().get("to"));
    }

    @Test
    void shouldStartInitializingWithDefaults() {
        SessionState state = SessionState.initializing("session_1", null, null, null, CREATED);

        assertEquals(SessionStatus.INITIALIZING, state.getStatus());
        assertEquals(100, state.getConfig().getMaxConversations());
        assertEquals(30, state.getConfig().getTimeoutMinutes());
        assertFalse(state.getConfig().isPersistenceEnabled());
        assertEquals(0, state.getConversationCount());
        assertEquals(CREATED, state.getCreatedAt());
    }

    @Test
    void shouldSnapshotMutableParts() {
        SessionState state = SessionState.initializing("session_1", null, null, Map.of("user", "u1"), CREATED);

        SessionState snapshot = state.snapshot();
        snapshot.getMetadata().put("user", "changed");

        assertEquals("u1", state.getMetadata().get("user"));
        assertNotSame(state.getConfig(), snapshot.getConfig());
    }

    @Test
    void shouldTreatActiveAndIdleAsLive() {
        assertTrue(SessionStatus.ACTIVE.isLive());
        assertTrue(SessionStatus.IDLE.isLive());
        assertFalse(SessionStatus.INITIALIZING.isLive());
        assertFalse(SessionStatus.TERMINATING.isLive());
        assertFalse(SessionStatus.TERMINATED.isLive());
    }
}
