package me.golemcore.sessions.domain.service;

import me.golemcore.sessions.domain.model.MemoryChangedEvent;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.domain.model.SessionEvent;
import me.golemcore.sessions.domain.model.SessionEventType;
import me.golemcore.sessions.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SessionEventPublisherTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final Duration WAIT = Duration.ofSeconds(2);

    private SpringEventBus eventBus;
    private SessionEventPublisher publisher;

    @BeforeEach
    void setUp() {
        eventBus = mock(SpringEventBus.class);
        publisher = new SessionEventPublisher(eventBus, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldStampEventsAndAddSessionId() {
        SessionEvent event = publisher.emit(SessionEventType.CONVERSATION_ADDED, "s1", Map.of("role", "user"));

        assertEquals(NOW, event.timestamp());
        assertEquals("s1", event.payload().get("session_id"));
        assertEquals("user", event.payload().get("role"));
        verify(eventBus).publish(event);
    }

    @Test
    void shouldRouteGlobalEventsToGlobalStreamOnly() {
        StepVerifier.create(publisher.globalEvents().take(2))
                .then(() -> {
                    publisher.emit(SessionEventType.CONVERSATION_ADDED, "s1", Map.of());
                    publisher.emit(SessionEventType.SESSION_CREATED, "s1", Map.of());
                    publisher.emit(SessionEventType.SESSION_STATUS, "s1", Map.of("status", "active"));
                })
                .expectNextMatches(e -> e.type() == SessionEventType.SESSION_CREATED)
                .expectNextMatches(e -> e.type() == SessionEventType.SESSION_STATUS)
                .expectComplete()
                .verify(WAIT);
    }

    @Test
    void shouldRouteSessionEventsToTheirSessionOnly() {
        StepVerifier.create(publisher.sessionEvents("s1").take(1))
                .then(() -> {
                    publisher.emit(SessionEventType.CONVERSATION_ADDED, "s2", Map.of());
                    publisher.emit(SessionEventType.SESSION_CREATED, "s1", Map.of());
                    publisher.emit(SessionEventType.CONVERSATION_ADDED, "s1", Map.of("content", "hi"));
                })
                .expectNextMatches(e -> "hi".equals(e.payload().get("content")))
                .expectComplete()
                .verify(WAIT);
    }

    @Test
    void shouldCompleteSessionStreamOnClose() {
        StepVerifier.create(publisher.sessionEvents("s1"))
                .then(() -> publisher.closeSession("s1"))
                .expectComplete()
                .verify(WAIT);
    }

    @Test
    void shouldTranslateStoredMemoriesIntoSessionEvents() {
        StepVerifier.create(publisher.sessionEvents("s1").take(1))
                .then(() -> {
                    publisher.onMemoryChanged(new MemoryChangedEvent("s1", "m0", MemoryType.FACT,
                            MemoryChangedEvent.Kind.DELETED));
                    publisher.onMemoryChanged(new MemoryChangedEvent("s1", "m1", MemoryType.FACT,
                            MemoryChangedEvent.Kind.STORED));
                })
                .expectNextMatches(e -> e.type() == SessionEventType.MEMORY_STORED
                        && "m1".equals(e.payload().get("memory_id")))
                .expectComplete()
                .verify(WAIT);
    }

    @Test
    void shouldSurviveFailingListeners() {
        doThrow(new IllegalStateException("listener down")).when(eventBus).publish(any());

        SessionEvent event = publisher.emit(SessionEventType.SESSION_CREATED, "s1", Map.of());

        assertEquals(SessionEventType.SESSION_CREATED, event.type());
    }
}
