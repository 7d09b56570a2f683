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

import java.util.List;

/**
 * Promotion decision for a single pending item.
 *
 * @param promote
 *            whether the item should be written to long-term memory
 * @param reason
 *            {@code importance}, {@code high_importance_override}, {@code age}
 *            for promotions; {@code below_threshold} or
 *            {@code low_confidence} for skips; {@code missing_fields} for
 *            items that cannot be promoted at all
 * @param missingFields
 *            required fields absent from an invalid item, empty otherwise
 */
public record ItemEvaluation(
        boolean promote,
        String reason,
        double importance,
        double confidence,
        MemoryType type,
        boolean typeInferred,
        List<String> missingFields) {

    public static final String REASON_IMPORTANCE = "importance";
    public static final String REASON_HIGH_IMPORTANCE = "high_importance_override";
    public static final String REASON_AGE = "age";
    public static final String REASON_BELOW_THRESHOLD = "below_threshold";
    public static final String REASON_LOW_CONFIDENCE = "low_confidence";
    public static final String REASON_EXPLICIT = "explicit";
    public static final String REASON_MISSING_FIELDS = "missing_fields";

    public ItemEvaluation {
        missingFields = missingFields != null ? List.copyOf(missingFields) : List.of();
    }

    public ItemEvaluation(boolean promote, String reason, double importance, double confidence, MemoryType type,
            boolean typeInferred) {
        this(promote, reason, importance, confidence, type, typeInferred, List.of());
    }

    public static ItemEvaluation invalid(List<String> missingFields) {
        return new ItemEvaluation(false, REASON_MISSING_FIELDS, 0.0, 0.0, null, false, missingFields);
    }

    /**
     * An invalid item is dropped and reported as failed, never re-queued.
     */
    public boolean isInvalid() {
        return !missingFields.isEmpty();
    }
}
