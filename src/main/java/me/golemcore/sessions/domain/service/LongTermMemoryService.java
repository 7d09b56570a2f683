package me.golemcore.sessions.domain.service;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.memory.LongTermStore;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import me.golemcore.sessions.infrastructure.event.SpringEventBus;
import me.golemcore.sessions.port.outbound.LongTermStoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Opens session-scoped {@link LongTermStore} handles.
 *
 * <p>
 * Opening is idempotent: while a handle for a session is open, the same
 * handle is returned; after it is closed, a new handle onto the same
 * partition is created, so previously persisted memories are visible again.
 */
@Service
@Slf4j
public class LongTermMemoryService {

    private static final int MAX_SESSION_ID_LENGTH = 256;
    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("[A-Za-z0-9_:-]+");

    private final LongTermStoragePort storage;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final SpringEventBus eventBus;
    private final SessionsProperties properties;

    private final Map<String, LongTermStore> handles = new ConcurrentHashMap<>();

    public LongTermMemoryService(LongTermStoragePort storage, Clock clock, ObjectMapper objectMapper,
            SpringEventBus eventBus, SessionsProperties properties) {
        this.storage = storage;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    public Result<LongTermStore> open(String sessionId) {
        Result<Void> valid = validateSessionId(sessionId);
        if (!valid.isSuccess()) {
            return valid.propagate();
        }
        LongTermStore handle = handles.compute(sessionId, (id, existing) -> {
            if (existing != null && !existing.isClosed()) {
                return existing;
            }
            log.debug("[LTM] Opening long-term memory for {}", id);
            return new LongTermStore(id, storage, clock, objectMapper,
                    properties.getMemory().getLongTerm().getMaxDataBytes(), eventBus::publish);
        });
        return Result.ok(handle);
    }

    /**
     * Closes the session's handle. Persisted memories are kept.
     */
    public void close(String sessionId) {
        LongTermStore handle = handles.remove(sessionId);
        if (handle != null) {
            handle.close();
            log.debug("[LTM] Closed long-term memory handle for {}", sessionId);
        }
    }

    public boolean isOpen(String sessionId) {
        LongTermStore handle = handles.get(sessionId);
        return handle != null && !handle.isClosed();
    }

    static Result<Void> validateSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Result.error(ErrorCode.EMPTY_FIELD, "Session id is required", Map.of("field", "session_id"));
        }
        if (sessionId.length() > MAX_SESSION_ID_LENGTH) {
            return Result.error(ErrorCode.INVALID_SESSION_ID,
                    "Session id exceeds " + MAX_SESSION_ID_LENGTH + " characters",
                    Map.of("field", "session_id", "length", sessionId.length()));
        }
        if (!SESSION_ID_PATTERN.matcher(sessionId).matches()) {
            return Result.error(ErrorCode.INVALID_SESSION_ID, "Session id contains unsupported characters",
                    Map.of("field", "session_id", "value", sessionId));
        }
        return Result.ok(null);
    }
}
