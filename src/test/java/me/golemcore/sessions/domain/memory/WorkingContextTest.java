package me.golemcore.sessions.domain.memory;

import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkingContextTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private MutableClock clock;
    private WorkingContext context;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        context = new WorkingContext(clock, 3);
    }

    @Test
    void shouldStoreAndReadValues() {
        context.put("task", "refactor");

        assertEquals("refactor", context.get("task"));
        assertEquals("fallback", context.get("missing", "fallback"));
        assertNull(context.get("missing"));
    }

    @Test
    void shouldEvictLeastRecentlyTouchedKey() {
        context.put("a", 1);
        context.put("b", 2);
        context.put("c", 3);
        context.get("a");

        Optional<String> evicted = context.put("d", 4);

        assertEquals(Optional.of("b"), evicted);
        assertEquals(List.of("a", "c", "d"), context.keys().stream().sorted().toList());
        assertEquals(3, context.count());
    }

    @Test
    void shouldTrackAccessStatistics() {
        context.put("a", 1);
        clock.advance(Duration.ofMinutes(5));

        context.get("a");
        context.get("a");

        assertEquals(2, context.accessCount("a"));
        assertEquals(Optional.of(NOW.plus(Duration.ofMinutes(5))), context.lastAccessed("a"));
    }

    @Test
    void shouldNotCountListAsAccess() {
        context.put("a", 1);

        Map<String, Object> snapshot = context.list();

        assertEquals(Map.of("a", 1), snapshot);
        assertEquals(0, context.accessCount("a"));
    }

    @Test
    void shouldReturnRecentKeysNewestFirst() {
        context.put("a", 1);
        context.put("b", 2);
        context.get("a");

        assertEquals(List.of("a", "b"), context.recentKeys(5));
    }

    @Test
    void shouldCollectEvictionsFromPutMany() {
        List<String> evicted = context.putMany(Map.of("a", 1, "b", 2, "c", 3, "d", 4));

        assertEquals(1, evicted.size());
        assertEquals(3, context.count());
    }

    @Test
    void shouldDeleteAndClear() {
        context.put("a", 1);

        assertTrue(context.delete("a"));
        assertFalse(context.delete("a"));

        context.put("b", 2);
        context.clear();
        assertEquals(0, context.count());
    }

    @Test
    void shouldRejectBlankKey() {
        assertThrows(IllegalArgumentException.class, () -> context.put(" ", 1));
    }

    @Test
    void shouldSuggestTypeFromKeyVocabulary() {
        assertEquals(MemoryType.DECISION, WorkingContext.suggestType("file_path", "x", MemoryType.DECISION));
        assertEquals(MemoryType.FILE_CONTEXT, WorkingContext.suggestType("Source_File", "x", null));
        assertEquals(MemoryType.ANALYSIS, WorkingContext.suggestType("next_step", "x", null));
        assertEquals(MemoryType.CONVERSATION, WorkingContext.suggestType("chat_log", "x", null));
        assertEquals(MemoryType.FACT, WorkingContext.suggestType("color", "x", null));
    }
}
