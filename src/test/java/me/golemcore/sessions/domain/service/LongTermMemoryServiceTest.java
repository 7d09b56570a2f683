package me.golemcore.sessions.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sessions.adapter.outbound.memory.InMemoryLongTermStorageAdapter;
import me.golemcore.sessions.domain.memory.LongTermStore;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.Memory;
import me.golemcore.sessions.domain.model.MemoryChangedEvent;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import me.golemcore.sessions.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class LongTermMemoryServiceTest {

    private SpringEventBus eventBus;
    private LongTermMemoryService service;

    @BeforeEach
    void setUp() {
        eventBus = mock(SpringEventBus.class);
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        service = new LongTermMemoryService(new InMemoryLongTermStorageAdapter(new ObjectMapper()), clock, new ObjectMapper(),
                eventBus, new SessionsProperties());
    }

    @Test
    void shouldReturnSameHandleWhileOpen() {
        LongTermStore first = service.open("session_1").getValue();
        LongTermStore second = service.open("session_1").getValue();

        assertSame(first, second);
        assertTrue(service.isOpen("session_1"));
    }

    @Test
    void shouldReopenOntoSamePartitionAfterClose() {
        LongTermStore first = service.open("session_1").getValue();
        first.persist(Memory.builder().id("m1").type(MemoryType.FACT).data("x").importance(0.5).build());

        service.close("session_1");
        LongTermStore reopened = service.open("session_1").getValue();

        assertTrue(first.isClosed());
        assertFalse(reopened.isClosed());
        assertNotSame(first, reopened);
        assertTrue(reopened.get("m1").isSuccess());
    }

    @Test
    void shouldPublishChangesThroughEventBus() {
        LongTermStore store = service.open("session_1").getValue();

        store.persist(Memory.builder().id("m1").type(MemoryType.FACT).data("x").importance(0.5).build());

        verify(eventBus).publish(any(MemoryChangedEvent.class));
    }

    @Test
    void shouldValidateSessionIds() {
        assertEquals(ErrorCode.EMPTY_FIELD, service.open(" ").getErrorCode());
        assertEquals(ErrorCode.INVALID_SESSION_ID, service.open("../etc").getErrorCode());
        assertEquals(ErrorCode.INVALID_SESSION_ID, service.open("a".repeat(257)).getErrorCode());
        assertTrue(service.open("session_abc-1:2").isSuccess());
    }
}
