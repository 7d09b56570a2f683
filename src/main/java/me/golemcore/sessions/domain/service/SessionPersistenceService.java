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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.domain.model.SavedSession;
import me.golemcore.sessions.domain.model.SessionState;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import me.golemcore.sessions.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Saves session state snapshots as JSON in workspace storage
 * ({@code sessions/<sessionId>.json}) and loads them back.
 */
@Service
@Slf4j
public class SessionPersistenceService {

    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    public SessionPersistenceService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            SessionsProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getSessionsDirectory();
    }

    public Result<SavedSession> save(SessionState state) {
        SavedSession saved = SavedSession.builder()
                .sessionId(state.getSessionId())
                .state(state.snapshot())
                .savedAt(clock.instant())
                .build();
        try {
            String json = objectMapper.writeValueAsString(saved);
            storagePort.putTextAtomic(directory, state.getSessionId() + JSON_EXTENSION, json, true).join();
            log.info("[Persistence] Saved session {}", state.getSessionId());
            return Result.ok(saved);
        } catch (JsonProcessingException | CompletionException e) {
            log.error("[Persistence] Failed to save session {}: {}", state.getSessionId(), e.getMessage());
            return Result.error(ErrorCode.STORAGE_FAILURE, "Failed to save session " + state.getSessionId(),
                    Map.of("session_id", state.getSessionId()));
        }
    }

    public Result<SavedSession> load(String sessionId) {
        Result<Void> valid = LongTermMemoryService.validateSessionId(sessionId);
        if (!valid.isSuccess()) {
            return valid.propagate();
        }
        try {
            String json = storagePort.getText(directory, sessionId + JSON_EXTENSION).join();
            if (json == null || json.isBlank()) {
                return notFound(sessionId);
            }
            return Result.ok(objectMapper.readValue(json, SavedSession.class));
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Persistence] Failed to load saved session {}: {}", sessionId, e.getMessage());
            return Result.error(ErrorCode.STORAGE_FAILURE, "Failed to load saved session " + sessionId,
                    Map.of("session_id", sessionId));
        }
    }

    /**
     * Saved sessions, most recently saved first. Unreadable files are skipped.
     */
    public Result<List<SavedSession>> listSaved() {
        List<String> files;
        try {
            files = storagePort.listObjects(directory, "").join();
        } catch (CompletionException e) {
            return Result.error(ErrorCode.STORAGE_FAILURE, "Failed to list saved sessions: " + e.getMessage());
        }
        List<SavedSession> saved = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION) || file.contains("/")) {
                continue;
            }
            Result<SavedSession> loaded = load(file.substring(0, file.length() - JSON_EXTENSION.length()));
            if (loaded.isSuccess()) {
                saved.add(loaded.getValue());
            }
        }
        saved.sort(Comparator.comparing(SavedSession::getSavedAt,
                Comparator.<Instant>nullsLast(Comparator.reverseOrder())));
        return Result.ok(saved);
    }

    public Result<Void> deleteSaved(String sessionId) {
        Result<Void> valid = LongTermMemoryService.validateSessionId(sessionId);
        if (!valid.isSuccess()) {
            return valid;
        }
        try {
            String file = sessionId + JSON_EXTENSION;
            if (!Boolean.TRUE.equals(storagePort.exists(directory, file).join())) {
                return notFound(sessionId);
            }
            storagePort.deleteObject(directory, file).join();
            log.info("[Persistence] Deleted saved session {}", sessionId);
            return Result.ok(null);
        } catch (CompletionException e) {
            return Result.error(ErrorCode.STORAGE_FAILURE, "Failed to delete saved session " + sessionId,
                    Map.of("session_id", sessionId));
        }
    }

    private static <T> Result<T> notFound(String sessionId) {
        return Result.error(ErrorCode.SAVED_SESSION_NOT_FOUND, "Saved session not found: " + sessionId,
                Map.of("session_id", sessionId));
    }
}
