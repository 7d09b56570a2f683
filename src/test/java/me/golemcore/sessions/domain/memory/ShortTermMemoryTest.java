package me.golemcore.sessions.domain.memory;

import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.domain.model.MessageRole;
import me.golemcore.sessions.domain.model.PendingMemoryItem;
import me.golemcore.sessions.domain.model.TokenBudget;
import me.golemcore.sessions.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShortTermMemoryTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final String SESSION_ID = "session_stm";

    private MutableClock clock;
    private ShortTermMemory stm;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        stm = new ShortTermMemory(SESSION_ID, clock);
    }

    @Test
    void shouldStartEmpty() {
        assertTrue(stm.isEmpty());
        assertEquals(SESSION_ID, stm.sessionId());
    }

    @Test
    void shouldStampMessagesWithClock() {
        ConversationBuffer.AddResult result = stm.addMessage(MessageRole.USER, "hello there");

        assertEquals(NOW, result.message().getTimestamp());
        assertEquals(1, stm.messageCount());
        assertEquals("hello there", stm.recentMessages(1).get(0).getContent());
        assertFalse(stm.isEmpty());
    }

    @Test
    void shouldQueueEvictedMessagesWhenEnabled() {
        ShortTermMemory promoting = new ShortTermMemory(SESSION_ID, clock, ShortTermMemory.Limits.builder()
                .budget(TokenBudget.builder().maxTokens(100).build())
                .promoteEvicted(true)
                .build());

        promoting.addMessage(MessageRole.USER, "x".repeat(160));
        promoting.addMessage(MessageRole.ASSISTANT, "y".repeat(160));
        promoting.addMessage(MessageRole.USER, "z".repeat(160));

        assertEquals(1, promoting.pendingCount());
        PendingMemoryItem item = promoting.peekPendingMemory().orElseThrow();
        assertEquals(MemoryType.CONVERSATION, item.getType());
        assertTrue(item.getId().startsWith("evicted_"));
        assertEquals("x".repeat(160), ((Map<?, ?>) item.getData()).get("content"));
    }

    @Test
    void shouldNotQueueEvictedMessagesByDefault() {
        ShortTermMemory small = new ShortTermMemory(SESSION_ID, clock, ShortTermMemory.Limits.builder()
                .maxMessages(1)
                .build());

        small.addMessage(MessageRole.USER, "first");
        small.addMessage(MessageRole.USER, "second");

        assertEquals(0, small.pendingCount());
        assertEquals(1, small.messageCount());
    }

    @Test
    void shouldDelegateWorkingContext() {
        stm.putContext("current_file", "Main.java");

        assertEquals("Main.java", stm.getContext("current_file", null));
        assertEquals(Map.of("current_file", "Main.java"), stm.listContext());
        assertTrue(stm.deleteContext("current_file"));
        assertEquals("none", stm.getContext("current_file", "none"));
    }

    @Test
    void shouldDelegatePendingQueue() {
        stm.enqueueMemory(PendingMemoryItem.builder().id("m1").data("fact").build());

        assertEquals(1, stm.pendingCount());
        assertEquals("m1", stm.dequeueMemory().getValue().getId());
        assertEquals(ErrorCode.EMPTY, stm.dequeueMemory().getErrorCode());
    }

    @Test
    void shouldSummarizeAllComponents() {
        stm.addMessage(MessageRole.USER, "hi");
        stm.putContext("k", "v");
        stm.enqueueMemory(PendingMemoryItem.builder().id("m1").data("fact").build());

        Map<String, Object> summary = stm.summary();

        assertEquals(SESSION_ID, summary.get("session_id"));
        assertEquals(1, summary.get("message_count"));
        assertEquals(1, summary.get("context_items"));
        assertEquals(1, summary.get("pending_count"));
        assertEquals(NOW, summary.get("last_accessed"));
    }

    @Test
    void shouldClearConversationOnly() {
        stm.addMessage(MessageRole.USER, "hi");
        stm.putContext("k", "v");

        stm.clearConversation();

        assertEquals(0, stm.messageCount());
        assertEquals(0, stm.tokenCount());
        assertEquals(1, stm.contextKeys().size());
    }
}
