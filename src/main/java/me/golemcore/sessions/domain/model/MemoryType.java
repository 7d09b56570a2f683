package me.golemcore.sessions.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of memory types shared by the pending queue, the promotion
 * engine and the long-term store.
 */
public enum MemoryType {

    FACT("fact", 0.5),
    ANALYSIS("analysis", 0.8),
    CONVERSATION("conversation", 0.4),
    FILE_CONTEXT("file_context", 0.6),
    DECISION("decision", 0.5),
    ASSUMPTION("assumption", 0.5),
    LESSON_LEARNED("lesson_learned", 0.5);

    private static final List<String> FILE_KEYS = List.of("file_path", "file", "path", "code", "module",
            "function");
    private static final List<String> ANALYSIS_KEYS = List.of("analysis", "conclusion", "reasoning", "summary",
            "finding");
    private static final List<String> CONVERSATION_KEYS = List.of("message", "utterance", "role", "content", "user",
            "assistant");

    private final String value;
    private final double baseImportance;

    MemoryType(String value, double baseImportance) {
        this.value = value;
        this.baseImportance = baseImportance;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Base importance used by the pending queue before age decay.
     */
    public double baseImportance() {
        return baseImportance;
    }

    @JsonCreator
    public static MemoryType fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown memory type: " + value));
    }

    public static Optional<MemoryType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MemoryType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Infers a type from the keys of a map payload. Non-map payloads are facts.
     */
    public static MemoryType infer(Object data) {
        if (!(data instanceof Map<?, ?> map) || map.isEmpty()) {
            return FACT;
        }
        if (containsAny(map, FILE_KEYS)) {
            return FILE_CONTEXT;
        }
        if (containsAny(map, ANALYSIS_KEYS)) {
            return ANALYSIS;
        }
        if (containsAny(map, CONVERSATION_KEYS)) {
            return CONVERSATION;
        }
        return FACT;
    }

    private static boolean containsAny(Map<?, ?> map, List<String> keys) {
        for (Object key : map.keySet()) {
            if (key != null && keys.contains(key.toString().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
