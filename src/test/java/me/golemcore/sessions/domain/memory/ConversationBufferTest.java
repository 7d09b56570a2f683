package me.golemcore.sessions.domain.memory;

import me.golemcore.sessions.domain.model.Message;
import me.golemcore.sessions.domain.model.MessageRole;
import me.golemcore.sessions.domain.model.TokenBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationBufferTest {

    // 160 chars -> 40 content tokens + 1 role + 4 overhead
    private static final String LONG_CONTENT = "x".repeat(160);
    private static final int LONG_TOKENS = 45;

    private ConversationBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new ConversationBuffer(TokenBudget.builder().maxTokens(100).build(), 10);
    }

    private static Message message(String content) {
        return Message.builder().role(MessageRole.USER).content(content).build();
    }

    @Test
    void shouldCacheTokenEstimateOnAdd() {
        ConversationBuffer.AddResult result = buffer.add(message(LONG_CONTENT));

        assertEquals(LONG_TOKENS, result.message().getEstimatedTokens());
        assertTrue(result.evicted().isEmpty());
        assertEquals(LONG_TOKENS, buffer.tokenCount());
    }

    @Test
    void shouldKeepMessagesAtExactlyOverheadLimit() {
        buffer.add(message(LONG_CONTENT));
        buffer.add(message(LONG_CONTENT));

        assertEquals(2, buffer.count());
        assertEquals(90, buffer.tokenCount());
    }

    @Test
    void shouldEvictOldestWhenOverBudget() {
        buffer.add(message(LONG_CONTENT + "a"));
        buffer.add(message(LONG_CONTENT + "b"));

        ConversationBuffer.AddResult result = buffer.add(message(LONG_CONTENT + "c"));

        assertEquals(1, result.evicted().size());
        assertEquals(LONG_CONTENT + "a", result.evicted().get(0).getContent());
        assertEquals(2, buffer.count());
        assertTrue(buffer.tokenCount() <= buffer.budget().overheadLimit());
    }

    @Test
    void shouldEvictMessageLargerThanWholeBudget() {
        ConversationBuffer.AddResult result = buffer.add(message("y".repeat(1000)));

        assertEquals(1, result.evicted().size());
        assertEquals(0, buffer.count());
        assertEquals(0, buffer.tokenCount());
    }

    @Test
    void shouldEnforceMaxMessages() {
        ConversationBuffer small = new ConversationBuffer(TokenBudget.defaults(), 3);
        for (int i = 0; i < 5; i++) {
            small.add(message("m" + i));
        }

        List<Message> all = small.all();
        assertEquals(3, all.size());
        assertEquals("m2", all.get(0).getContent());
        assertEquals("m4", all.get(2).getContent());
    }

    @Test
    void shouldKeepTokenTotalEqualToSumOfRetainedMessages() {
        for (int i = 0; i < 20; i++) {
            buffer.add(message("z".repeat(i * 10)));
            int sum = buffer.all().stream().mapToInt(Message::getEstimatedTokens).sum();
            assertEquals(sum, buffer.tokenCount());
            assertTrue(buffer.tokenCount() <= 90);
            assertTrue(buffer.count() <= 10);
        }
    }

    @Test
    void shouldReturnRecentInChronologicalOrder() {
        buffer.add(message("first"));
        buffer.add(message("second"));
        buffer.add(message("third"));

        List<Message> recent = buffer.recent(2);

        assertEquals(List.of("second", "third"), recent.stream().map(Message::getContent).toList());
        assertEquals(3, buffer.recent(50).size());
        assertTrue(buffer.recent(0).isEmpty());
    }

    @Test
    void shouldTrimToTokensAndCount() {
        buffer.add(message("a".repeat(40)));
        buffer.add(message("b".repeat(40)));
        buffer.add(message("c".repeat(40)));

        List<Message> evicted = buffer.trimToTokens(30);
        assertEquals(2, evicted.size());
        assertEquals(15, buffer.tokenCount());

        buffer.add(message("d"));
        buffer.trimToCount(1);
        assertEquals(1, buffer.count());
        assertEquals("d", buffer.recent(1).get(0).getContent());
    }

    @Test
    void shouldClearAndFind() {
        buffer.add(message("needle"));
        assertTrue(buffer.find(m -> "needle".equals(m.getContent())).isPresent());

        buffer.clear();

        assertEquals(0, buffer.count());
        assertEquals(0, buffer.tokenCount());
    }

    @Test
    void shouldRejectMessageWithoutRole() {
        assertThrows(IllegalArgumentException.class, () -> buffer.add(Message.builder().content("x").build()));
    }
}
