package me.golemcore.sessions.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sessions.adapter.outbound.memory.InMemoryLongTermStorageAdapter;
import me.golemcore.sessions.domain.memory.LongTermStore;
import me.golemcore.sessions.domain.memory.ShortTermMemory;
import me.golemcore.sessions.domain.memory.ShortTermMemoryAccess;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.ItemEvaluation;
import me.golemcore.sessions.domain.model.Memory;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.domain.model.PendingMemoryItem;
import me.golemcore.sessions.domain.model.PromotionOptions;
import me.golemcore.sessions.domain.model.PromotionResult;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.domain.model.SessionEventType;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import me.golemcore.sessions.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryPromotionServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final String SESSION_ID = "session_promo";

    private MutableClock clock;
    private SessionEventPublisher eventPublisher;
    private MemoryPromotionService service;
    private ShortTermMemory stm;
    private ShortTermMemoryAccess access;
    private LongTermStore ltm;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        eventPublisher = mock(SessionEventPublisher.class);
        service = new MemoryPromotionService(clock, new SessionsProperties(), eventPublisher);
        stm = new ShortTermMemory(SESSION_ID, clock);
        access = ShortTermMemoryAccess.direct(stm);
        ltm = new LongTermStore(SESSION_ID, new InMemoryLongTermStorageAdapter(new ObjectMapper()), clock, new ObjectMapper(), 0,
                null);
    }

    private void enqueue(String id, MemoryType type, Double importance) {
        Result<PendingMemoryItem> result = stm.enqueueMemory(PendingMemoryItem.builder()
                .id(id)
                .type(type)
                .importance(importance)
                .data(Map.of("note", id))
                .build());
        assertTrue(result.isSuccess());
    }

    private List<String> pendingIds() {
        return stm.pendingQueue().toList().stream().map(PendingMemoryItem::getId).toList();
    }

    // ==================== implicit cycle ====================

    @Test
    void shouldPromoteImportantItems() {
        enqueue("m1", MemoryType.FACT, null);

        PromotionResult result = service.promote(access, ltm, null).getValue();

        assertEquals(1, result.getPromoted().size());
        PromotionResult.Promoted promoted = result.getPromoted().get(0);
        assertEquals("m1", promoted.id());
        assertEquals(ItemEvaluation.REASON_IMPORTANCE, promoted.reason());
        assertEquals(0.65, promoted.confidence(), 1e-9);
        assertEquals(0, stm.pendingCount());

        Memory stored = ltm.get("m1").getValue();
        assertEquals(MemoryType.FACT, stored.getType());
        assertEquals(0.5, stored.getImportance(), 1e-9);
        verify(eventPublisher).emit(eq(SessionEventType.MEMORY_PROMOTED), eq(SESSION_ID), anyMap());
    }

    @Test
    void shouldKeepSkippedItemsAndPromoteThemOnceOldEnough() {
        enqueue("low", MemoryType.FACT, 0.3);

        PromotionResult first = service.promote(access, ltm, null).getValue();

        assertTrue(first.getPromoted().isEmpty());
        assertEquals(ItemEvaluation.REASON_BELOW_THRESHOLD, first.getSkipped().get(0).reason());
        assertEquals(List.of("low"), pendingIds());

        clock.advance(Duration.ofSeconds(301));
        PromotionResult second = service.promote(access, ltm, null).getValue();

        assertEquals(ItemEvaluation.REASON_AGE, second.getPromoted().get(0).reason());
        assertEquals(0, stm.pendingCount());
        assertTrue(ltm.get("low").isSuccess());
    }

    @Test
    void shouldPromoteHighImportanceRegardlessOfThreshold() {
        enqueue("critical", MemoryType.FACT, 0.85);
        PromotionOptions strict = service.defaultOptions().toBuilder().minImportance(0.95).build();

        PromotionResult result = service.promote(access, ltm, strict).getValue();

        assertEquals(ItemEvaluation.REASON_HIGH_IMPORTANCE, result.getPromoted().get(0).reason());
    }

    @Test
    void shouldSkipLowConfidenceCandidates() {
        enqueue("weak", MemoryType.FACT, 0.6);
        PromotionOptions picky = service.defaultOptions().toBuilder().minConfidence(0.99).build();

        PromotionResult result = service.promote(access, ltm, picky).getValue();

        assertEquals(ItemEvaluation.REASON_LOW_CONFIDENCE, result.getSkipped().get(0).reason());
        assertEquals(List.of("weak"), pendingIds());
    }

    @Test
    void shouldStopAfterOnePassOverSkippedItems() {
        enqueue("a", MemoryType.FACT, 0.1);
        enqueue("b", MemoryType.FACT, 0.2);
        enqueue("c", MemoryType.FACT, 0.3);

        PromotionResult result = service.promote(access, ltm, null).getValue();

        assertEquals(3, result.getIterations());
        assertEquals(3, result.getSkipped().size());
        assertEquals(List.of("a", "b", "c"), pendingIds());
    }

    @Test
    void shouldRespectBatchSize() {
        for (int i = 0; i < 5; i++) {
            enqueue("m" + i, MemoryType.ANALYSIS, null);
        }
        PromotionOptions small = service.defaultOptions().toBuilder().batchSize(2).build();

        PromotionResult result = service.promote(access, ltm, small).getValue();

        assertEquals(2, result.getPromoted().size());
        assertEquals(List.of("m2", "m3", "m4"), pendingIds());
    }

    @Test
    void shouldRespectIterationCap() {
        for (int i = 0; i < 5; i++) {
            enqueue("m" + i, MemoryType.FACT, 0.1);
        }
        PromotionOptions capped = service.defaultOptions().toBuilder().maxIterations(2).build();

        PromotionResult result = service.promote(access, ltm, capped).getValue();

        assertEquals(2, result.getIterations());
        assertEquals(5, stm.pendingCount());
    }

    @Test
    void shouldInferMissingType() {
        stm.enqueueMemory(PendingMemoryItem.builder()
                .id("analysis")
                .importance(0.9)
                .data(Map.of("analysis", "root cause", "conclusion", "fix it"))
                .build());

        PromotionResult result = service.promote(access, ltm, null).getValue();

        assertEquals(MemoryType.ANALYSIS, result.getPromoted().get(0).type());
    }

    // ==================== failures ====================

    @Test
    void shouldRequeueOnStorageFailure() {
        LongTermStore failing = mock(LongTermStore.class);
        when(failing.sessionId()).thenReturn(SESSION_ID);
        when(failing.persist(any(Memory.class)))
                .thenReturn(Result.error(ErrorCode.STORAGE_FAILURE, "disk full"));
        enqueue("m1", MemoryType.ANALYSIS, null);

        PromotionResult result = service.promote(access, failing, null).getValue();

        assertEquals(1, result.getFailed().size());
        assertTrue(result.getFailed().get(0).requeued());
        assertEquals(List.of("m1"), pendingIds());
        verify(failing, times(1)).persist(any(Memory.class));
    }

    @Test
    void shouldDropItemsRejectedByValidation() {
        LongTermStore rejecting = mock(LongTermStore.class);
        when(rejecting.sessionId()).thenReturn(SESSION_ID);
        when(rejecting.persist(any(Memory.class)))
                .thenReturn(Result.error(ErrorCode.DATA_TOO_LARGE, "too big"));
        enqueue("m1", MemoryType.ANALYSIS, null);

        PromotionResult result = service.promote(access, rejecting, null).getValue();

        assertFalse(result.getFailed().get(0).requeued());
        assertEquals(0, stm.pendingCount());
    }

    @Test
    void shouldRejectItemWithoutPayloadOnEvaluation() {
        PendingMemoryItem item = PendingMemoryItem.builder()
                .id("x")
                .type(MemoryType.FACT)
                .importance(0.9)
                .build();

        ItemEvaluation evaluation = service.evaluate(item, service.defaultOptions(), NOW);

        assertFalse(evaluation.promote());
        assertTrue(evaluation.isInvalid());
        assertEquals(ItemEvaluation.REASON_MISSING_FIELDS, evaluation.reason());
        assertEquals(List.of("data"), evaluation.missingFields());
    }

    @Test
    void shouldDropInvalidItemDuringImplicitCycle() {
        PendingMemoryItem invalid = PendingMemoryItem.builder().id("x").importance(0.9).build();
        ShortTermMemory memory = mock(ShortTermMemory.class);
        when(memory.peekPendingMemory()).thenReturn(Optional.of(invalid), Optional.empty());
        when(memory.dequeueMemory()).thenReturn(Result.ok(invalid));

        PromotionResult result = service.promote(ShortTermMemoryAccess.direct(memory), ltm, null).getValue();

        assertTrue(result.getPromoted().isEmpty());
        assertEquals(1, result.getFailed().size());
        assertEquals(ErrorCode.MISSING_FIELDS, result.getFailed().get(0).errorCode());
        assertFalse(result.getFailed().get(0).requeued());
        verify(memory, never()).enqueueMemory(any(PendingMemoryItem.class));
        assertEquals(0, ltm.count().getValue());
    }

    @Test
    void shouldDropInvalidItemDuringExplicitPromotion() {
        PendingMemoryItem invalid = PendingMemoryItem.builder().type(MemoryType.FACT).data("orphan").build();
        ShortTermMemory memory = mock(ShortTermMemory.class);
        when(memory.dequeueMemory()).thenReturn(Result.ok(invalid),
                Result.error(ErrorCode.EMPTY, "Pending queue is empty"));

        PromotionResult result = service.promoteAll(ShortTermMemoryAccess.direct(memory), ltm).getValue();

        assertEquals(1, result.getFailed().size());
        assertEquals(ErrorCode.MISSING_FIELDS, result.getFailed().get(0).errorCode());
        verify(memory, never()).enqueueMemory(any(PendingMemoryItem.class));
        assertEquals(0, ltm.count().getValue());
    }

    @Test
    void shouldRejectConcurrentCycleForSameSession() throws Exception {
        enqueue("m1", MemoryType.ANALYSIS, null);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ShortTermMemoryAccess blocking = new ShortTermMemoryAccess() {
            @Override
            public <T> T withShortTermMemory(Function<ShortTermMemory, T> action) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return access.withShortTermMemory(action);
            }
        };

        CompletableFuture<Result<PromotionResult>> running = CompletableFuture
                .supplyAsync(() -> service.promote(blocking, ltm, null));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Result<PromotionResult> concurrent = service.promote(access, ltm, null);
        release.countDown();

        assertEquals(ErrorCode.PROMOTION_IN_PROGRESS, concurrent.getErrorCode());
        assertTrue(running.get(5, TimeUnit.SECONDS).isSuccess());
    }

    // ==================== explicit ====================

    @Test
    void shouldPromoteEverythingExplicitly() {
        enqueue("low", MemoryType.FACT, 0.05);
        enqueue("high", MemoryType.DECISION, 0.9);

        PromotionResult result = service.promoteAll(access, ltm).getValue();

        assertEquals(2, result.getPromoted().size());
        assertTrue(result.getPromoted().stream()
                .allMatch(p -> ItemEvaluation.REASON_EXPLICIT.equals(p.reason())));
        assertEquals(0, stm.pendingCount());
        assertEquals(2, ltm.count().getValue());
    }

    // ==================== scoring ====================

    @Test
    void shouldScoreDataQuality() {
        assertEquals(0.0, MemoryPromotionService.dataQuality(null));
        assertEquals(0.0, MemoryPromotionService.dataQuality(Map.of()));
        assertEquals(0.5, MemoryPromotionService.dataQuality(Map.of("a", 1)));
        assertEquals(1.0, MemoryPromotionService.dataQuality(Map.of("a", 1, "b", 2, "c", 3)));
        assertEquals(0.7, MemoryPromotionService.dataQuality(Map.of("a", Map.of("b", 1))), 1e-9);
        assertEquals(0.5, MemoryPromotionService.dataQuality(42));
    }
}
