package me.golemcore.sessions.adapter.inbound.web.controller;

import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.domain.model.SessionEvent;
import me.golemcore.sessions.domain.model.SessionEventType;
import me.golemcore.sessions.domain.model.SessionException;
import me.golemcore.sessions.domain.model.SessionState;
import me.golemcore.sessions.domain.service.SessionEventPublisher;
import me.golemcore.sessions.domain.service.SessionLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventsControllerTest {

    private SessionEventPublisher eventPublisher;
    private SessionLifecycleService lifecycleService;
    private EventsController controller;

    @BeforeEach
    void setUp() {
        eventPublisher = mock(SessionEventPublisher.class);
        lifecycleService = mock(SessionLifecycleService.class);
        controller = new EventsController(eventPublisher, lifecycleService);
    }

    @Test
    void shouldNameGlobalEventsByType() {
        SessionEvent event = event(SessionEventType.SESSION_CREATED, "s1");
        when(eventPublisher.globalEvents()).thenReturn(Flux.just(event));

        StepVerifier.create(controller.globalEvents())
                .assertNext(sse -> {
                    assertEquals("session_created", sse.event());
                    assertSame(event, sse.data());
                })
                .verifyComplete();
    }

    @Test
    void shouldStreamSessionEventsForKnownSession() {
        when(lifecycleService.getInfo("s1")).thenReturn(Result.ok(new SessionState()));
        when(eventPublisher.sessionEvents("s1"))
                .thenReturn(Flux.just(event(SessionEventType.CONVERSATION_ADDED, "s1"),
                        event(SessionEventType.MEMORY_PROMOTED, "s1")));

        StepVerifier.create(controller.sessionEvents("s1"))
                .assertNext(sse -> assertEquals("conversation_added", sse.event()))
                .assertNext(sse -> assertEquals("memory_promoted", sse.event()))
                .verifyComplete();
    }

    @Test
    void shouldRejectStreamForUnknownSession() {
        when(lifecycleService.getInfo("ghost"))
                .thenReturn(Result.error(ErrorCode.SESSION_NOT_FOUND, "Session not found: ghost"));

        SessionException ex = assertThrows(SessionException.class, () -> controller.sessionEvents("ghost"));
        assertEquals(ErrorCode.SESSION_NOT_FOUND, ex.getErrorCode());
        verify(eventPublisher, never()).sessionEvents(anyString());
    }

    private SessionEvent event(SessionEventType type, String sessionId) {
        return SessionEvent.builder()
                .type(type)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .sessionId(sessionId)
                .payload(Map.of())
                .build();
    }
}
