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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.memory.LongTermStore;
import me.golemcore.sessions.domain.memory.TokenEstimator;
import me.golemcore.sessions.domain.model.EnrichOptions;
import me.golemcore.sessions.domain.model.EnrichedContext;
import me.golemcore.sessions.domain.model.Memory;
import me.golemcore.sessions.domain.model.MemoryChangedEvent;
import me.golemcore.sessions.domain.model.MemoryFilter;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.domain.model.RetrievalQuery;
import me.golemcore.sessions.domain.model.ScoredMemory;
import me.golemcore.sessions.domain.model.SessionEvent;
import me.golemcore.sessions.domain.model.SessionEventType;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Relevance-ranked search over a session's long-term memories.
 *
 * <p>
 * Relevance is {@code keyword*0.4 + recency*0.2 + importance*0.2 + type*0.2}:
 * <ul>
 * <li>keyword - fraction of query keywords found in the serialized data</li>
 * <li>recency - {@code max(0, 1 - ageHours/24)^2} on {@code updatedAt}</li>
 * <li>importance - the stored importance</li>
 * <li>type - 1.0 on match, 0.5 without a type filter, 0.0 on mismatch</li>
 * </ul>
 * When keywords are given, memories matching none of them are excluded.
 *
 * <p>
 * Cached results are scoped by session and dropped whenever that session's
 * memories change or the session terminates.
 */
@Service
@Slf4j
public class MemoryRetrievalService {

    private static final double WEIGHT_KEYWORD = 0.4;
    private static final double WEIGHT_RECENCY = 0.2;
    private static final double WEIGHT_IMPORTANCE = 0.2;
    private static final double WEIGHT_TYPE = 0.2;
    private static final double NO_TIMESTAMP_RECENCY = 0.5;
    private static final double RECENCY_WINDOW_HOURS = 24.0;
    private static final String KEY_SEPARATOR = "|";

    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final SessionsProperties properties;

    private final Map<String, CachedResult> resultCache = new ConcurrentHashMap<>();
    private ScheduledExecutorService cacheCleanupExecutor;

    public MemoryRetrievalService(Clock clock, ObjectMapper objectMapper, SessionsProperties properties) {
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        long ttl = Math.max(1, properties.getRetrieval().getCacheTtlMinutes());
        cacheCleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retrieval-cache-cleanup");
            t.setDaemon(true);
            return t;
        });
        cacheCleanupExecutor.scheduleAtFixedRate(this::evictExpired, ttl, ttl, TimeUnit.MINUTES);
    }

    @PreDestroy
    public void destroy() {
        if (cacheCleanupExecutor != null) {
            cacheCleanupExecutor.shutdownNow();
        }
    }

    /**
     * Ranks the session's memories against {@code query}, best first.
     */
    public Result<List<ScoredMemory>> search(LongTermStore store, RetrievalQuery query) {
        RetrievalQuery effective = query != null ? query : new RetrievalQuery();
        MemoryFilter filter = MemoryFilter.builder()
                .type(effective.getType())
                .minImportance(effective.getMinImportance())
                .build();
        Result<List<Memory>> candidates = store.query(filter);
        if (!candidates.isSuccess()) {
            return candidates.propagate();
        }

        Instant now = clock.instant();
        List<String> keywords = effective.normalizedKeywords();
        List<ScoredMemory> scored = new ArrayList<>();
        for (Memory memory : candidates.getValue()) {
            String text = searchableText(memory);
            List<String> matched = matchReasons(text, keywords);
            if (!keywords.isEmpty() && matched.isEmpty()) {
                continue;
            }
            scored.add(new ScoredMemory(memory, score(memory, keywords, matched.size(), effective.getType(), now),
                    matched));
        }

        List<ScoredMemory> ranked = scored.stream()
                .sorted(Comparator.comparingDouble(ScoredMemory::relevance).reversed()
                        .thenComparing((ScoredMemory s) -> s.memory().getUpdatedAt(),
                                Comparator.<Instant>nullsLast(Comparator.reverseOrder())))
                .limit(effectiveLimit(effective))
                .toList();
        log.debug("[Retrieval] {}: {} of {} memories matched", store.sessionId(), ranked.size(),
                candidates.getValue().size());
        return Result.ok(ranked);
    }

    /**
     * Like {@link #search(LongTermStore, RetrievalQuery)}, served from the
     * session-scoped cache when enabled.
     */
    public Result<List<ScoredMemory>> searchWithCache(LongTermStore store, RetrievalQuery query) {
        RetrievalQuery effective = query != null ? query : new RetrievalQuery();
        if (!properties.getRetrieval().isCacheEnabled()) {
            return search(store, effective);
        }
        String key = store.sessionId() + KEY_SEPARATOR + effective.cacheKey(effectiveLimit(effective));
        CachedResult cached = resultCache.get(key);
        if (cached != null && !cached.isExpired(clock.instant())) {
            log.debug("[Retrieval] Cache HIT for {}", store.sessionId());
            return Result.ok(cached.results());
        }
        Result<List<ScoredMemory>> result = search(store, effective);
        if (result.isSuccess()) {
            cacheResult(key, result.getValue());
        }
        return result;
    }

    /**
     * Relevance of a memory for a query, in [0, 1], rounded to three decimals.
     */
    public double calculateRelevance(Memory memory, RetrievalQuery query) {
        List<String> keywords = query != null ? query.normalizedKeywords() : List.of();
        List<String> matched = matchReasons(searchableText(memory), keywords);
        return score(memory, keywords, matched.size(), query != null ? query.getType() : null, clock.instant());
    }

    /**
     * Keywords of {@code query} found in the memory's data.
     */
    public List<String> matchReasons(Memory memory, RetrievalQuery query) {
        return matchReasons(searchableText(memory), query != null ? query.normalizedKeywords() : List.of());
    }

    /**
     * Picks the best memories that fit into a token budget and summarizes them.
     */
    public Result<EnrichedContext> enrichContext(LongTermStore store, RetrievalQuery query, EnrichOptions options) {
        EnrichOptions effective = options != null ? options : new EnrichOptions();
        int maxTokens = effective.getMaxTokens() != null
                ? effective.getMaxTokens()
                : properties.getRetrieval().getDefaultMaxTokens();

        Result<List<ScoredMemory>> found = search(store, query);
        if (!found.isSuccess()) {
            return found.propagate();
        }

        List<ScoredMemory> selected = new ArrayList<>();
        int usedTokens = 0;
        for (ScoredMemory candidate : found.getValue()) {
            int tokens = TokenEstimator.estimateTokens(serialize(candidate.memory().getData()));
            if (usedTokens + tokens > maxTokens) {
                break;
            }
            selected.add(candidate);
            usedTokens += tokens;
        }

        Instant now = clock.instant();
        EnrichedContext context = EnrichedContext.builder()
                .memories(selected)
                .groups(group(selected, effective.getGroupBy(), now))
                .summary(summarize(selected))
                .count(selected.size())
                .estimatedTokens(usedTokens)
                .lastRetrieved(now)
                .build();
        return Result.ok(context);
    }

    /**
     * Drops every cached result of the session.
     */
    public void invalidateSession(String sessionId) {
        String prefix = sessionId + KEY_SEPARATOR;
        resultCache.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public void clearCache() {
        resultCache.clear();
    }

    int cacheSize() {
        return resultCache.size();
    }

    @EventListener
    public void onMemoryChanged(MemoryChangedEvent event) {
        invalidateSession(event.sessionId());
    }

    @EventListener
    public void onSessionEvent(SessionEvent event) {
        if (event.type() == SessionEventType.SESSION_TERMINATED && event.sessionId() != null) {
            invalidateSession(event.sessionId());
        }
    }

    private double score(Memory memory, List<String> keywords, int matchedCount, MemoryType type, Instant now) {
        double keywordScore = keywords.isEmpty() ? 0.0 : (double) matchedCount / keywords.size();
        double importance = memory.getImportance() != null ? memory.getImportance() : 0.0;
        double typeScore;
        if (type == null) {
            typeScore = 0.5;
        } else {
            typeScore = type == memory.getType() ? 1.0 : 0.0;
        }
        double relevance = keywordScore * WEIGHT_KEYWORD
                + recency(memory, now) * WEIGHT_RECENCY
                + importance * WEIGHT_IMPORTANCE
                + typeScore * WEIGHT_TYPE;
        return Math.round(Math.max(0.0, Math.min(1.0, relevance)) * 1000.0) / 1000.0;
    }

    private static double recency(Memory memory, Instant now) {
        Instant timestamp = memory.getUpdatedAt() != null ? memory.getUpdatedAt() : memory.getCreatedAt();
        if (timestamp == null) {
            return NO_TIMESTAMP_RECENCY;
        }
        double hours = Math.max(0, Duration.between(timestamp, now).toMillis()) / 3_600_000.0;
        double linear = Math.max(0.0, 1.0 - hours / RECENCY_WINDOW_HOURS);
        return linear * linear;
    }

    private static List<String> matchReasons(String text, List<String> keywords) {
        return keywords.stream().filter(text::contains).toList();
    }

    private String searchableText(Memory memory) {
        return serialize(memory.getData()).toLowerCase(Locale.ROOT);
    }

    private String serialize(Object data) {
        if (data == null) {
            return "";
        }
        if (data instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            return String.valueOf(data);
        }
    }

    private Map<String, List<ScoredMemory>> group(List<ScoredMemory> memories, EnrichOptions.GroupBy groupBy,
            Instant now) {
        Map<String, List<ScoredMemory>> groups = new LinkedHashMap<>();
        if (groupBy == null || groupBy == EnrichOptions.GroupBy.NONE) {
            return groups;
        }
        for (ScoredMemory memory : memories) {
            String key = groupBy == EnrichOptions.GroupBy.TYPE
                    ? typeName(memory.memory().getType())
                    : recencyBucket(memory.memory(), now);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(memory);
        }
        return groups;
    }

    private static String recencyBucket(Memory memory, Instant now) {
        Instant timestamp = memory.getUpdatedAt() != null ? memory.getUpdatedAt() : memory.getCreatedAt();
        if (timestamp == null) {
            return "unknown";
        }
        Duration age = Duration.between(timestamp, now);
        if (age.compareTo(Duration.ofHours(1)) <= 0) {
            return "last_hour";
        }
        if (age.compareTo(Duration.ofDays(1)) <= 0) {
            return "today";
        }
        if (age.compareTo(Duration.ofDays(7)) <= 0) {
            return "this_week";
        }
        return "older";
    }

    static String summarize(List<ScoredMemory> memories) {
        if (memories.isEmpty()) {
            return "No relevant memories found";
        }
        Map<String, Long> byType = memories.stream()
                .collect(Collectors.groupingBy(m -> typeName(m.memory().getType()), LinkedHashMap::new,
                        Collectors.counting()));
        String types = byType.entrySet().stream()
                .map(e -> e.getValue() + " " + e.getKey())
                .collect(Collectors.joining(", "));
        double avg = memories.stream().mapToDouble(ScoredMemory::relevance).average().orElse(0.0);
        return String.format(Locale.ROOT, "Found %d memories (%s), avg relevance: %.2f", memories.size(), types, avg);
    }

    private static String typeName(MemoryType type) {
        return type != null ? type.value() : "unknown";
    }

    private int effectiveLimit(RetrievalQuery query) {
        return query.getLimit() != null && query.getLimit() > 0
                ? query.getLimit()
                : properties.getRetrieval().getDefaultLimit();
    }

    private void cacheResult(String key, List<ScoredMemory> results) {
        SessionsProperties.RetrievalProperties config = properties.getRetrieval();
        if (resultCache.size() >= config.getCacheMaxSize()) {
            evictOldest();
        }
        resultCache.put(key, new CachedResult(List.copyOf(results), clock.instant(),
                Duration.ofMinutes(config.getCacheTtlMinutes())));
    }

    private void evictOldest() {
        // Remove ~10% of oldest entries
        int toRemove = Math.max(1, resultCache.size() / 10);
        List<Map.Entry<String, CachedResult>> entries = new ArrayList<>(resultCache.entrySet());
        entries.sort(Comparator.comparing(e -> e.getValue().createdAt()));
        for (int i = 0; i < toRemove && i < entries.size(); i++) {
            resultCache.remove(entries.get(i).getKey());
        }
    }

    private void evictExpired() {
        Instant now = clock.instant();
        resultCache.entrySet().removeIf(e -> e.getValue().isExpired(now));
    }

    private record CachedResult(List<ScoredMemory> results, Instant createdAt, Duration ttl) {
        boolean isExpired(Instant now) {
            return now.isAfter(createdAt.plus(ttl));
        }
    }
}
