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
 * Observable state of a session.
 *
 * <p>
 * {@code sessionId} never changes after creation. Every successful transition
 * or update refreshes {@code updatedAt}; a rejected transition leaves the
 * state untouched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionState {

    private String sessionId;

    @Builder.Default
    private SessionStatus status = SessionStatus.INITIALIZING;

    @Builder.Default
    private SessionConfig config = new SessionConfig();

    @Builder.Default
    private Map<String, Object> llmConfig = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private List<String> activeTasks = new ArrayList<>();

    private int conversationCount;
    private String error;

    public static SessionState initializing(String sessionId, SessionConfig config, Map<String, Object> llmConfig,
            Map<String, Object> metadata, Instant now) {
        return SessionState.builder()
                .sessionId(sessionId)
                .status(SessionStatus.INITIALIZING)
                .config(config != null ? config.copy() : new SessionConfig())
                .llmConfig(llmConfig != null ? new LinkedHashMap<>(llmConfig) : new LinkedHashMap<>())
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Moves to {@code target} if the edge is allowed.
     *
     * @return the previous status, or {@code invalid_transition}
     */
    public Result<SessionStatus> transitionTo(SessionStatus target, Instant now) {
        if (status == null || !status.canTransitionTo(target)) {
            return Result.error(ErrorCode.INVALID_TRANSITION,
                    "Cannot transition from " + value(status) + " to " + value(target),
                    Map.of("from", value(status), "to", value(target)));
        }
        SessionStatus previous = status;
        status = target;
        updatedAt = now;
        return Result.ok(previous);
    }

    public void touch(Instant now) {
        updatedAt = now;
    }

    public void incrementConversationCount(Instant now) {
        conversationCount++;
        updatedAt = now;
    }

    public void decrementConversationCount(Instant now) {
        if (conversationCount > 0) {
            conversationCount--;
        }
        updatedAt = now;
    }

    /**
     * Deep enough copy for handing out to callers.
     */
    public SessionState snapshot() {
        return toBuilder()
                .config(config != null ? config.copy() : new SessionConfig())
                .llmConfig(new LinkedHashMap<>(llmConfig != null ? llmConfig : Map.of()))
                .metadata(new LinkedHashMap<>(metadata != null ? metadata : Map.of()))
                .activeTasks(new ArrayList<>(activeTasks != null ? activeTasks : List.of()))
                .build();
    }

    private static String value(SessionStatus status) {
        return status != null ? status.value() : "null";
    }
}
