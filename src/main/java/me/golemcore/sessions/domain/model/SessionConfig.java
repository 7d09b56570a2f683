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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-session configuration chosen at creation time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionConfig {

    @Builder.Default
    private int maxConversations = 100;

    @Builder.Default
    private int timeoutMinutes = 30;

    @Builder.Default
    private boolean persistenceEnabled = false;

    @Builder.Default
    private Set<String> features = new LinkedHashSet<>();

    public SessionConfig copy() {
        return toBuilder()
                .features(features != null ? new LinkedHashSet<>(features) : new LinkedHashSet<>())
                .build();
    }
}
