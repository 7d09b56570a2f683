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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Memories selected for a prompt context together with a short summary.
 * {@code groups} is filled only when grouping by type or recency.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedContext {

    @Builder.Default
    private List<ScoredMemory> memories = new ArrayList<>();

    @Builder.Default
    private Map<String, List<ScoredMemory>> groups = new LinkedHashMap<>();

    private String summary;
    private int count;
    private int estimatedTokens;
    private Instant lastRetrieved;
}
