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
 * Long-term store query. All set criteria must match; {@code limit} applies
 * after filtering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryFilter {

    private MemoryType type;
    private Double minImportance;
    private Integer limit;

    public static MemoryFilter all() {
        return new MemoryFilter();
    }

    public boolean matches(Memory memory) {
        if (type != null && type != memory.getType()) {
            return false;
        }
        if (minImportance != null) {
            double importance = memory.getImportance() != null ? memory.getImportance() : 0.0;
            return importance >= minImportance;
        }
        return true;
    }
}
