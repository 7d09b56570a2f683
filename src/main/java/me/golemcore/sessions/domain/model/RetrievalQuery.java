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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Search criteria for long-term memory retrieval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalQuery {

    @Builder.Default
    private List<String> keywords = new ArrayList<>();
    private MemoryType type;
    private Double minImportance;
    private Integer limit;

    /**
     * Lower-cased non-blank keywords.
     */
    public List<String> normalizedKeywords() {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    /**
     * Stable textual form used as a cache key.
     */
    public String cacheKey(int effectiveLimit) {
        String kw = normalizedKeywords().stream().sorted().collect(Collectors.joining(","));
        return "kw=" + kw
                + "|type=" + (type != null ? type.value() : "")
                + "|min=" + (minImportance != null ? minImportance : "")
                + "|limit=" + effectiveLimit;
    }
}
