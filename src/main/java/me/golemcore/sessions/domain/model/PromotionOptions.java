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

/**
 * Criteria for one promotion cycle. {@code maxAgeSeconds == null} disables
 * age-based promotion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PromotionOptions {

    @Builder.Default
    private double minImportance = 0.5;

    @Builder.Default
    private Long maxAgeSeconds = 300L;

    @Builder.Default
    private double minConfidence = 0.3;

    @Builder.Default
    private int batchSize = 10;

    @Builder.Default
    private int maxIterations = 100;

    @Builder.Default
    private boolean inferTypes = true;
}
