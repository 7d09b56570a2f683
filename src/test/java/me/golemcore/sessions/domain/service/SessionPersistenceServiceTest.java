package me.golemcore.sessions.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.sessions.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.SavedSession;
import me.golemcore.sessions.domain.model.SessionState;
import me.golemcore.sessions.domain.model.SessionStatus;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import me.golemcore.sessions.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionPersistenceServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SessionPersistenceService service;

    @BeforeEach
    void setUp() {
        SessionsProperties properties = new SessionsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        clock = new MutableClock(NOW);
        service = new SessionPersistenceService(storage, objectMapper, clock, properties);
    }

    private static SessionState state(String id) {
        SessionState state = SessionState.initializing(id, null, Map.of("model", "test-model"),
                Map.of("user", "u1"), NOW);
        state.transitionTo(SessionStatus.ACTIVE, NOW);
        state.incrementConversationCount(NOW);
        return state;
    }

    @Test
    void shouldSaveAndLoadState() {
        service.save(state("session_a"));

        SavedSession loaded = service.load("session_a").getValue();

        assertTrue(Files.exists(tempDir.resolve("sessions").resolve("session_a.json")));
        assertEquals(NOW, loaded.getSavedAt());
        assertEquals(SessionStatus.ACTIVE, loaded.getState().getStatus());
        assertEquals(1, loaded.getState().getConversationCount());
        assertEquals("u1", loaded.getState().getMetadata().get("user"));
        assertEquals("test-model", loaded.getState().getLlmConfig().get("model"));
    }

    @Test
    void shouldReportMissingAndInvalidIds() {
        assertEquals(ErrorCode.SAVED_SESSION_NOT_FOUND, service.load("session_missing").getErrorCode());
        assertEquals(ErrorCode.INVALID_SESSION_ID, service.load("../secret").getErrorCode());
        assertEquals(ErrorCode.SAVED_SESSION_NOT_FOUND, service.deleteSaved("session_missing").getErrorCode());
    }

    @Test
    void shouldListMostRecentlySavedFirst() {
        service.save(state("session_a"));
        clock.advance(Duration.ofMinutes(1));
        service.save(state("session_b"));

        List<SavedSession> saved = service.listSaved().getValue();

        assertEquals(List.of("session_b", "session_a"), saved.stream().map(SavedSession::getSessionId).toList());
    }

    @Test
    void shouldDeleteSavedSession() {
        service.save(state("session_a"));

        assertTrue(service.deleteSaved("session_a").isSuccess());
        assertEquals(ErrorCode.SAVED_SESSION_NOT_FOUND, service.load("session_a").getErrorCode());
    }
}
