package me.golemcore.sessions.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.memory.LongTermStore;
import me.golemcore.sessions.domain.memory.PendingQueue;
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
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Moves pending short-term memories into long-term storage.
 *
 * <p>
 * An implicit cycle walks the pending queue once. An item without an id or a
 * data key is dropped and reported as failed ({@code missing_fields}). Every
 * other item is evaluated in this order:
 * <ol>
 * <li>importance ≥ {@code minImportance}: promote ({@code importance})</li>
 * <li>importance ≥ 0.8: promote ({@code high_importance_override})</li>
 * <li>age ≥ {@code maxAgeSeconds}: promote ({@code age})</li>
 * <li>otherwise skip ({@code below_threshold})</li>
 * </ol>
 * A promotion candidate whose confidence is below {@code minConfidence} is
 * skipped as {@code low_confidence}. Skipped items go back to the queue in the
 * same step they were taken out, so they are never lost.
 *
 * <p>
 * The queue is touched only inside short-term memory actions; long-term
 * writes happen outside them. Only one cycle per session runs at a time.
 */
@Service
@Slf4j
public class MemoryPromotionService {

    static final double HIGH_IMPORTANCE_OVERRIDE = 0.8;

    private static final double WEIGHT_IMPORTANCE = 0.4;
    private static final double WEIGHT_QUALITY = 0.3;
    private static final double WEIGHT_TYPE = 0.2;
    private static final double WEIGHT_RECENCY = 0.1;

    private final Clock clock;
    private final SessionsProperties properties;
    private final SessionEventPublisher eventPublisher;

    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();

    public MemoryPromotionService(Clock clock, SessionsProperties properties,
            SessionEventPublisher eventPublisher) {
        this.clock = clock;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Options built from {@code sessions.promotion.*}.
     */
    public PromotionOptions defaultOptions() {
        SessionsProperties.PromotionProperties promotion = properties.getPromotion();
        return PromotionOptions.builder()
                .minImportance(promotion.getMinImportance())
                .maxAgeSeconds(promotion.getMaxAgeSeconds())
                .minConfidence(promotion.getMinConfidence())
                .batchSize(promotion.getBatchSize())
                .maxIterations(promotion.getMaxIterations())
                .inferTypes(promotion.isInferTypes())
                .build();
    }

    /**
     * Runs one implicit promotion cycle for a session.
     *
     * @return the cycle outcome, or {@code promotion_in_progress} when another
     *         cycle for the same session is running
     */
    public Result<PromotionResult> promote(ShortTermMemoryAccess shortTerm, LongTermStore longTerm,
            PromotionOptions options) {
        PromotionOptions effective = options != null ? options : defaultOptions();
        return withSessionLock(longTerm.sessionId(), () -> runImplicit(shortTerm, longTerm, effective));
    }

    /**
     * Drains the queue and writes every item, bypassing the criteria. Only
     * write errors keep an item out of long-term storage.
     */
    public Result<PromotionResult> promoteAll(ShortTermMemoryAccess shortTerm, LongTermStore longTerm) {
        PromotionOptions options = defaultOptions();
        return withSessionLock(longTerm.sessionId(), () -> runExplicit(shortTerm, longTerm, options));
    }

    /**
     * Drops the per-session lock once a session is gone.
     */
    public void forget(String sessionId) {
        sessionLocks.remove(sessionId);
    }

    /**
     * Evaluates a single pending item against the criteria.
     */
    public ItemEvaluation evaluate(PendingMemoryItem item, PromotionOptions options, Instant now) {
        List<String> missing = missingFields(item);
        if (!missing.isEmpty()) {
            return ItemEvaluation.invalid(missing);
        }
        double importance = PendingQueue.effectiveImportance(item, now);
        Duration age = PendingQueue.age(item, now);
        boolean inferred = item.getType() == null;
        MemoryType type = resolveType(item, options);
        double confidence = calculateConfidence(item, importance, inferred, age, options);

        String reason;
        if (importance >= options.getMinImportance()) {
            reason = ItemEvaluation.REASON_IMPORTANCE;
        } else if (importance >= HIGH_IMPORTANCE_OVERRIDE) {
            reason = ItemEvaluation.REASON_HIGH_IMPORTANCE;
        } else if (options.getMaxAgeSeconds() != null && age.getSeconds() >= options.getMaxAgeSeconds()) {
            reason = ItemEvaluation.REASON_AGE;
        } else {
            return new ItemEvaluation(false, ItemEvaluation.REASON_BELOW_THRESHOLD, importance, confidence, type,
                    inferred);
        }
        if (confidence < options.getMinConfidence()) {
            return new ItemEvaluation(false, ItemEvaluation.REASON_LOW_CONFIDENCE, importance, confidence, type,
                    inferred);
        }
        return new ItemEvaluation(true, reason, importance, confidence, type, inferred);
    }

    /**
     * {@code importance*0.4 + quality*0.3 + typeSpecificity*0.2 + recency*0.1},
     * clamped to [0, 1] and rounded to three decimals.
     */
    public double calculateConfidence(PendingMemoryItem item, double importance, boolean typeInferred,
            Duration age, PromotionOptions options) {
        double quality = dataQuality(item.getData());
        double typeSpecificity = typeInferred ? 0.5 : 1.0;
        double recency = 0.0;
        if (options.getMaxAgeSeconds() != null && options.getMaxAgeSeconds() > 0) {
            double ratio = (double) age.getSeconds() / options.getMaxAgeSeconds();
            recency = 1.0 - Math.min(ratio, 1.0);
        }
        double confidence = importance * WEIGHT_IMPORTANCE
                + quality * WEIGHT_QUALITY
                + typeSpecificity * WEIGHT_TYPE
                + recency * WEIGHT_RECENCY;
        return round3(Math.max(0.0, Math.min(1.0, confidence)));
    }

    static List<String> missingFields(PendingMemoryItem item) {
        List<String> missing = new ArrayList<>();
        if (item.getId() == null || item.getId().isBlank()) {
            missing.add("id");
        }
        if (!item.isDataPresent()) {
            missing.add("data");
        }
        return missing;
    }

    static double dataQuality(Object data) {
        if (data == null) {
            return 0.0;
        }
        if (data instanceof Map<?, ?> map) {
            if (map.isEmpty()) {
                return 0.0;
            }
            double quality = map.size() >= 3 ? 1.0 : 0.5;
            boolean nested = map.values().stream().anyMatch(v -> v instanceof Map<?, ?>);
            if (nested) {
                quality += 0.2;
            }
            return Math.min(1.0, quality);
        }
        if (data instanceof String text) {
            return text.isBlank() ? 0.0 : 0.5;
        }
        return 0.5;
    }

    private MemoryType resolveType(PendingMemoryItem item, PromotionOptions options) {
        if (item.getType() != null) {
            return item.getType();
        }
        return options.isInferTypes() ? MemoryType.infer(item.getData()) : MemoryType.FACT;
    }

    private Result<PromotionResult> withSessionLock(String sessionId,
            Supplier<PromotionResult> cycle) {
        ReentrantLock lock = sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        if (!lock.tryLock()) {
            return Result.error(ErrorCode.PROMOTION_IN_PROGRESS,
                    "A promotion cycle is already running for " + sessionId,
                    Map.of("session_id", sessionId));
        }
        try {
            return Result.ok(cycle.get());
        } finally {
            lock.unlock();
        }
    }

    private PromotionResult runImplicit(ShortTermMemoryAccess shortTerm, LongTermStore longTerm,
            PromotionOptions options) {
        PromotionResult result = new PromotionResult();
        Set<String> processed = new HashSet<>();
        int iterations = 0;

        while (iterations < options.getMaxIterations() && result.getPromoted().size() < options.getBatchSize()) {
            Step step = shortTerm.withShortTermMemory(stm -> takeNext(stm, processed, options));
            if (step == null) {
                break;
            }
            iterations++;
            processed.add(step.item().getId());

            if (step.evaluation().isInvalid()) {
                reject(longTerm.sessionId(), step.item(), step.evaluation(), result);
                continue;
            }
            if (!step.evaluation().promote()) {
                ItemEvaluation evaluation = step.evaluation();
                result.getSkipped().add(new PromotionResult.Skipped(step.item().getId(), evaluation.reason(),
                        evaluation.importance(), evaluation.confidence()));
                log.debug("[Promotion] {} skipped {}: {}", longTerm.sessionId(), step.item().getId(),
                        evaluation.reason());
                continue;
            }
            write(shortTerm, longTerm, step.item(), step.evaluation(), result);
        }

        result.setIterations(iterations);
        if (iterations >= options.getMaxIterations()) {
            log.warn("[Promotion] {} stopped after {} iterations", longTerm.sessionId(), iterations);
        }
        logOutcome(longTerm.sessionId(), result);
        return result;
    }

    private PromotionResult runExplicit(ShortTermMemoryAccess shortTerm, LongTermStore longTerm,
            PromotionOptions options) {
        PromotionResult result = new PromotionResult();
        List<PendingMemoryItem> drained = shortTerm.withShortTermMemory(stm -> {
            List<PendingMemoryItem> items = new ArrayList<>();
            Result<PendingMemoryItem> next = stm.dequeueMemory();
            while (next.isSuccess()) {
                items.add(next.getValue());
                next = stm.dequeueMemory();
            }
            return items;
        });

        Instant now = clock.instant();
        for (PendingMemoryItem item : drained) {
            List<String> missing = missingFields(item);
            if (!missing.isEmpty()) {
                reject(longTerm.sessionId(), item, ItemEvaluation.invalid(missing), result);
                continue;
            }
            double importance = PendingQueue.effectiveImportance(item, now);
            boolean inferred = item.getType() == null;
            ItemEvaluation evaluation = new ItemEvaluation(true, ItemEvaluation.REASON_EXPLICIT, importance,
                    calculateConfidence(item, importance, inferred, PendingQueue.age(item, now), options),
                    resolveType(item, options), inferred);
            write(shortTerm, longTerm, item, evaluation, result);
        }
        result.setIterations(drained.size());
        logOutcome(longTerm.sessionId(), result);
        return result;
    }

    private Step takeNext(ShortTermMemory stm, Set<String> processed, PromotionOptions options) {
        Optional<PendingMemoryItem> head = stm.peekPendingMemory();
        if (head.isEmpty() || processed.contains(head.get().getId())) {
            return null;
        }
        PendingMemoryItem item = stm.dequeueMemory().getValue();
        ItemEvaluation evaluation = evaluate(item, options, clock.instant());
        if (!evaluation.promote() && !evaluation.isInvalid()) {
            stm.enqueueMemory(item);
        }
        return new Step(item, evaluation);
    }

    private void write(ShortTermMemoryAccess shortTerm, LongTermStore longTerm, PendingMemoryItem item,
            ItemEvaluation evaluation, PromotionResult result) {
        Memory memory = Memory.builder()
                .id(item.getId())
                .type(evaluation.type())
                .data(item.getData())
                .importance(evaluation.importance())
                .build();
        Result<Memory> stored = longTerm.persist(memory);
        if (stored.isSuccess()) {
            result.getPromoted().add(new PromotionResult.Promoted(item.getId(), evaluation.type(),
                    evaluation.importance(), evaluation.confidence(), evaluation.reason()));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("memory_id", item.getId());
            payload.put("type", evaluation.type().value());
            payload.put("confidence", evaluation.confidence());
            payload.put("reason", evaluation.reason());
            eventPublisher.emit(SessionEventType.MEMORY_PROMOTED, longTerm.sessionId(), payload);
            return;
        }

        boolean requeued = false;
        if (!stored.getErrorCode().isValidationError()) {
            requeued = requeue(shortTerm, item);
        }
        result.getFailed().add(new PromotionResult.Failed(item.getId(), stored.getErrorCode(), stored.getMessage(),
                requeued));
        log.warn("[Promotion] {} failed to promote {}: {} (requeued={})", longTerm.sessionId(), item.getId(),
                stored.getMessage(), requeued);
    }

    private void reject(String sessionId, PendingMemoryItem item, ItemEvaluation evaluation,
            PromotionResult result) {
        String message = "Missing required fields: " + evaluation.missingFields();
        result.getFailed().add(new PromotionResult.Failed(item.getId(), ErrorCode.MISSING_FIELDS, message, false));
        log.warn("[Promotion] {} dropped invalid item {}: {}", sessionId, item.getId(), message);
    }

    private boolean requeue(ShortTermMemoryAccess shortTerm, PendingMemoryItem item) {
        try {
            return shortTerm.withShortTermMemory(stm -> stm.enqueueMemory(item).isSuccess());
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Promotion] Could not requeue {}: {}", item.getId(), e.getMessage());
            return false;
        }
    }

    private void logOutcome(String sessionId, PromotionResult result) {
        if (!result.getPromoted().isEmpty() || !result.getFailed().isEmpty()) {
            log.info("[Promotion] {}: promoted={}, skipped={}, failed={}", sessionId,
                    result.getPromoted().size(), result.getSkipped().size(), result.getFailed().size());
        }
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private record Step(PendingMemoryItem item, ItemEvaluation evaluation) {
    }
}
