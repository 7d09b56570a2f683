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
 * Long-term memory record owned by exactly one session.
 *
 * <p>
 * {@code sessionId}, {@code createdAt} and {@code updatedAt} are stamped by
 * the long-term store; caller-provided values are overwritten. Updates keep
 * {@code createdAt}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Memory {

    private String id;
    private String sessionId;
    private MemoryType type;
    private Object data;
    private Double importance;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    private boolean dataPresent;

    public void setData(Object data) {
        this.data = data;
        this.dataPresent = true;
    }

    public static class MemoryBuilder {

        public MemoryBuilder data(Object data) {
            this.data = data;
            this.dataPresent = true;
            return this;
        }
    }
}
