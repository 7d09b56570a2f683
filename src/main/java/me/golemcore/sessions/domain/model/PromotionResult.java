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

/**
 * Outcome of a promotion cycle. Every item touched by the cycle ends up in
 * exactly one of the three lists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionResult {

    @Builder.Default
    private List<Promoted> promoted = new ArrayList<>();

    @Builder.Default
    private List<Skipped> skipped = new ArrayList<>();

    @Builder.Default
    private List<Failed> failed = new ArrayList<>();

    private int iterations;

    public record Promoted(String id, MemoryType type, double importance, double confidence, String reason) {
    }

    public record Skipped(String id, String reason, double importance, double confidence) {
    }

    public record Failed(String id, ErrorCode errorCode, String message, boolean requeued) {
    }
}
