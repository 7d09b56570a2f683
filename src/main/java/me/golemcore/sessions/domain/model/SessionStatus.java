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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Session lifecycle status.
 *
 * <pre>
 * INITIALIZING → ACTIVE | TERMINATED
 * ACTIVE       → IDLE | TERMINATING
 * IDLE         → ACTIVE | TERMINATING
 * TERMINATING  → TERMINATED
 * TERMINATED   → (none)
 * </pre>
 */
public enum SessionStatus {

    INITIALIZING("initializing"),
    ACTIVE("active"),
    IDLE("idle"),
    TERMINATING("terminating"),
    TERMINATED("terminated");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Set<SessionStatus> allowedTargets() {
        return switch (this) {
        case INITIALIZING -> EnumSet.of(ACTIVE, TERMINATED);
        case ACTIVE -> EnumSet.of(IDLE, TERMINATING);
        case IDLE -> EnumSet.of(ACTIVE, TERMINATING);
        case TERMINATING -> EnumSet.of(TERMINATED);
        case TERMINATED -> EnumSet.noneOf(SessionStatus.class);
        };
    }

    public boolean canTransitionTo(SessionStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    /**
     * Whether the session accepts client work in this status.
     */
    public boolean isLive() {
        return this == ACTIVE || this == IDLE;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (SessionStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
