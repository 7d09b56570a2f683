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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Candidate memory waiting in the pending queue for promotion to long-term
 * storage.
 *
 * <p>
 * {@code data} may legitimately be {@code null}; {@code dataPresent} tells an
 * explicit null apart from an omitted payload. {@code importance} is optional
 * and computed from type and age when absent. {@code type} is optional and
 * inferred from the payload during promotion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingMemoryItem {

    private String id;
    private MemoryType type;
    private Object data;
    private Double importance;
    private Instant enqueuedAt;

    @JsonIgnore
    private boolean dataPresent;

    public void setData(Object data) {
        this.data = data;
        this.dataPresent = true;
    }

    public static class PendingMemoryItemBuilder {

        public PendingMemoryItemBuilder data(Object data) {
            this.data = data;
            this.dataPresent = true;
            return this;
        }
    }
}
