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

import me.golemcore.sessions.domain.model.MemoryType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded key/value scratchpad of a session.
 *
 * <p>
 * Entries are kept in touch order (oldest first); writes and reads move an
 * entry to the end. When a put exceeds {@code maxItems}, the least recently
 * touched entry is evicted.
 *
 * <p>
 * Not thread-safe. Owned by a single session worker.
 */
public class WorkingContext {

    public static final int DEFAULT_MAX_ITEMS = 50;

    private static final List<String> FILE_HINTS = List.of("file", "path", "directory", "folder");
    private static final List<String> ANALYSIS_HINTS = List.of("analysis", "result", "conclusion", "decision",
            "recommendation", "task", "todo", "action", "step");
    private static final List<String> CONVERSATION_HINTS = List.of("message", "chat", "dialog", "conversation");

    private final Clock clock;
    private final int maxItems;
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

    public WorkingContext(Clock clock, int maxItems) {
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive: " + maxItems);
        }
        this.clock = clock;
        this.maxItems = maxItems;
    }

    /**
     * Inserts or replaces a value. Replacing resets the access statistics.
     *
     * @return the key evicted to make room, if any
     */
    public Optional<String> put(String key, Object value) {
        requireKey(key);
        entries.remove(key);
        entries.put(key, new Entry(value, clock.instant(), 0));
        if (entries.size() > maxItems) {
            String eldest = entries.keySet().iterator().next();
            entries.remove(eldest);
            return Optional.of(eldest);
        }
        return Optional.empty();
    }

    /**
     * Puts every entry of {@code values}, in iteration order.
     *
     * @return keys evicted along the way
     */
    public List<String> putMany(Map<String, Object> values) {
        List<String> evicted = new ArrayList<>();
        values.forEach((k, v) -> put(k, v).ifPresent(evicted::add));
        return evicted;
    }

    /**
     * Returns the value for {@code key} and records the access, or
     * {@code defaultValue} when absent.
     */
    public Object get(String key, Object defaultValue) {
        Entry entry = entries.remove(key);
        if (entry == null) {
            return defaultValue;
        }
        Entry touched = new Entry(entry.value(), clock.instant(), entry.accessCount() + 1);
        entries.put(key, touched);
        return touched.value();
    }

    public Object get(String key) {
        return get(key, null);
    }

    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    /**
     * Snapshot of all entries. Does not count as access.
     */
    public Map<String, Object> list() {
        Map<String, Object> copy = new LinkedHashMap<>();
        entries.forEach((k, e) -> copy.put(k, e.value()));
        return copy;
    }

    public void clear() {
        entries.clear();
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public int count() {
        return entries.size();
    }

    public int maxItems() {
        return maxItems;
    }

    public Optional<Instant> lastAccessed(String key) {
        Entry entry = entries.get(key);
        return entry != null ? Optional.of(entry.lastAccessed()) : Optional.empty();
    }

    public int accessCount(String key) {
        Entry entry = entries.get(key);
        return entry != null ? entry.accessCount() : 0;
    }

    /**
     * Most recently touched keys first.
     */
    public List<String> recentKeys(int n) {
        List<String> keys = new ArrayList<>(entries.keySet());
        Collections.reverse(keys);
        return keys.subList(0, Math.min(Math.max(n, 0), keys.size()));
    }

    /**
     * Suggests a memory type for a context entry. An explicit hint wins;
     * otherwise the key is matched case-insensitively against file, analysis and
     * conversation vocabularies in that order.
     */
    public static MemoryType suggestType(String key, Object value, MemoryType hint) {
        if (hint != null) {
            return hint;
        }
        if (key == null) {
            return MemoryType.FACT;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        if (containsAny(lower, FILE_HINTS)) {
            return MemoryType.FILE_CONTEXT;
        }
        if (containsAny(lower, ANALYSIS_HINTS)) {
            return MemoryType.ANALYSIS;
        }
        if (containsAny(lower, CONVERSATION_HINTS)) {
            return MemoryType.CONVERSATION;
        }
        return MemoryType.FACT;
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Context key is required");
        }
    }

    private record Entry(Object value, Instant lastAccessed, int accessCount) {
    }
}
