package me.golemcore.sessions.domain.memory;

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

import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.domain.model.PendingMemoryItem;
import me.golemcore.sessions.domain.model.Result;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Bounded FIFO of memories waiting for promotion.
 *
 * <p>
 * Enqueue never drops silently: a full queue rejects with
 * {@code queue_full}. Importance of an item without an explicit value is
 * derived from its type and age: {@code base * max(0.5, 1 - 0.1 * ageHours)}.
 *
 * <p>
 * Not thread-safe. Owned by a single session worker.
 */
public class PendingQueue {

    public static final int DEFAULT_MAX_SIZE = 20;
    public static final double DEFAULT_READY_IMPORTANCE = 0.7;

    private static final double DECAY_PER_HOUR = 0.1;
    private static final double MIN_DECAY_FACTOR = 0.5;
    private static final double SECONDS_PER_HOUR = 3600.0;

    private final Clock clock;
    private final int maxSize;
    private final Deque<PendingMemoryItem> items = new ArrayDeque<>();

    public PendingQueue(Clock clock, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.clock = clock;
        this.maxSize = maxSize;
    }

    /**
     * Validates and appends an item, stamping {@code enqueuedAt} when missing.
     */
    public Result<PendingMemoryItem> enqueue(PendingMemoryItem item) {
        if (item == null) {
            return Result.error(ErrorCode.MISSING_FIELDS, "Pending item is required",
                    Map.of("fields", List.of("id", "data")));
        }
        List<String> missing = new ArrayList<>();
        if (item.getId() == null || item.getId().isBlank()) {
            missing.add("id");
        }
        if (!item.isDataPresent()) {
            missing.add("data");
        }
        if (!missing.isEmpty()) {
            return Result.error(ErrorCode.MISSING_FIELDS, "Missing required fields: " + missing,
                    Map.of("fields", missing));
        }
        Double importance = item.getImportance();
        if (importance != null && (importance < 0.0 || importance > 1.0)) {
            return Result.error(ErrorCode.INVALID_IMPORTANCE, "Importance must be within [0, 1]",
                    Map.of("field", "importance", "value", importance));
        }
        if (items.size() >= maxSize) {
            return Result.error(ErrorCode.QUEUE_FULL, "Pending queue is full",
                    Map.of("max_size", maxSize));
        }
        PendingMemoryItem stored = item.getEnqueuedAt() != null
                ? item
                : item.toBuilder().enqueuedAt(clock.instant()).build();
        items.addLast(stored);
        return Result.ok(stored);
    }

    public Result<PendingMemoryItem> dequeue() {
        PendingMemoryItem head = items.pollFirst();
        if (head == null) {
            return Result.error(ErrorCode.EMPTY, "Pending queue is empty");
        }
        return Result.ok(head);
    }

    public Optional<PendingMemoryItem> peek() {
        return Optional.ofNullable(items.peekFirst());
    }

    /**
     * Item with the highest effective importance; the earliest one on ties.
     */
    public Optional<PendingMemoryItem> peekPriority() {
        Instant now = clock.instant();
        PendingMemoryItem best = null;
        double bestImportance = -1.0;
        for (PendingMemoryItem item : items) {
            double importance = effectiveImportance(item, now);
            if (importance > bestImportance) {
                best = item;
                bestImportance = importance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Items worth promoting, without removing them.
     *
     * @param minImportance
     *            lowest effective importance
     * @param maxAge
     *            when non-null, only items enqueued at most this long ago
     */
    public List<PendingMemoryItem> readyForPromotion(double minImportance, Duration maxAge) {
        Instant now = clock.instant();
        return items.stream()
                .filter(item -> effectiveImportance(item, now) >= minImportance)
                .filter(item -> maxAge == null || age(item, now).compareTo(maxAge) <= 0)
                .toList();
    }

    public List<PendingMemoryItem> readyForPromotion() {
        return readyForPromotion(DEFAULT_READY_IMPORTANCE, null);
    }

    public double calculateImportance(PendingMemoryItem item) {
        return calculateImportance(item, clock.instant());
    }

    /**
     * Type base importance decayed by age, rounded to two decimals.
     */
    public static double calculateImportance(PendingMemoryItem item, Instant now) {
        double base = item.getType() != null ? item.getType().baseImportance() : MemoryType.FACT.baseImportance();
        double ageHours = age(item, now).toMillis() / 1000.0 / SECONDS_PER_HOUR;
        double factor = Math.max(MIN_DECAY_FACTOR, 1.0 - DECAY_PER_HOUR * ageHours);
        return Math.round(base * factor * 100.0) / 100.0;
    }

    /**
     * Explicit importance when set, calculated otherwise.
     */
    public static double effectiveImportance(PendingMemoryItem item, Instant now) {
        return item.getImportance() != null ? item.getImportance() : calculateImportance(item, now);
    }

    public static Duration age(PendingMemoryItem item, Instant now) {
        if (item.getEnqueuedAt() == null || item.getEnqueuedAt().isAfter(now)) {
            return Duration.ZERO;
        }
        return Duration.between(item.getEnqueuedAt(), now);
    }

    /**
     * Removes the items with the given ids. Unknown ids are ignored.
     *
     * @return number of items removed
     */
    public int clearPromoted(Collection<String> ids) {
        Set<String> idSet = new HashSet<>(ids);
        return removeWhere(item -> idSet.contains(item.getId()));
    }

    public int removeWhere(Predicate<PendingMemoryItem> predicate) {
        int removed = 0;
        Iterator<PendingMemoryItem> it = items.iterator();
        while (it.hasNext()) {
            if (predicate.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public List<PendingMemoryItem> filterByType(MemoryType type) {
        return items.stream().filter(item -> item.getType() == type).toList();
    }

    public List<PendingMemoryItem> filterByImportance(double minImportance) {
        Instant now = clock.instant();
        return items.stream()
                .filter(item -> effectiveImportance(item, now) >= minImportance)
                .sorted(Comparator.comparingDouble((PendingMemoryItem item) -> effectiveImportance(item, now))
                        .reversed())
                .toList();
    }

    public List<PendingMemoryItem> toList() {
        return new ArrayList<>(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isFull() {
        return items.size() >= maxSize;
    }

    public int maxSize() {
        return maxSize;
    }

    public void clear() {
        items.clear();
    }
}
