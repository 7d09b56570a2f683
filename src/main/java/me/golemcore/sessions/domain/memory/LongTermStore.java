package me.golemcore.sessions.domain.memory;

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
import me.golemcore.sessions.domain.model.Memory;
import me.golemcore.sessions.domain.model.MemoryChangedEvent;
import me.golemcore.sessions.domain.model.MemoryFilter;
import me.golemcore.sessions.domain.model.MemoryPatch;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.domain.model.SessionException;
import me.golemcore.sessions.port.outbound.LongTermStoragePort;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Session-scoped handle onto long-term storage.
 *
 * <p>
 * Every operation is confined to the partition of {@link #sessionId()}.
 * Persisted records are stamped with the handle's session id and timestamps.
 * Payloads are deep-copied on the way in and out, so callers never share
 * mutable state with a stored record. Closing the handle detaches it; the
 * records stay in storage.
 */
@Slf4j
public class LongTermStore {

    private static final Comparator<Memory> CREATION_ORDER = Comparator
            .comparing(Memory::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Memory::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String sessionId;
    private final LongTermStoragePort storage;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final int maxDataBytes;
    private final Consumer<MemoryChangedEvent> changeListener;

    private volatile boolean closed;

    public LongTermStore(String sessionId, LongTermStoragePort storage, Clock clock, ObjectMapper objectMapper,
            int maxDataBytes, Consumer<MemoryChangedEvent> changeListener) {
        this.sessionId = sessionId;
        this.storage = storage;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.maxDataBytes = maxDataBytes;
        this.changeListener = changeListener != null ? changeListener : event -> {
        };
    }

    public String sessionId() {
        return sessionId;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Validates and stores a memory under this session.
     *
     * @return the stored record, or {@code missing_fields},
     *         {@code invalid_importance}, {@code data_too_large},
     *         {@code storage_failure}, {@code handle_closed}
     */
    public synchronized Result<Memory> persist(Memory memory) {
        if (closed) {
            return closedError();
        }
        if (memory == null) {
            return Result.error(ErrorCode.MISSING_FIELDS, "Memory is required",
                    Map.of("fields", List.of("id", "type", "data", "importance")));
        }
        List<String> missing = new ArrayList<>();
        if (memory.getId() == null || memory.getId().isBlank()) {
            missing.add("id");
        }
        if (memory.getType() == null) {
            missing.add("type");
        }
        if (!memory.isDataPresent()) {
            missing.add("data");
        }
        if (memory.getImportance() == null) {
            missing.add("importance");
        }
        if (!missing.isEmpty()) {
            return Result.error(ErrorCode.MISSING_FIELDS, "Missing required fields: " + missing,
                    Map.of("fields", missing));
        }
        Result<Void> checked = checkImportance(memory.getImportance());
        if (!checked.isSuccess()) {
            return checked.propagate();
        }
        checked = checkSize(memory.getData());
        if (!checked.isSuccess()) {
            return checked.propagate();
        }

        Result<Object> data = copyData(memory.getData());
        if (!data.isSuccess()) {
            return data.propagate();
        }
        Instant now = clock.instant();
        Memory stored = memory.toBuilder()
                .data(data.getValue())
                .sessionId(sessionId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return write(stored, MemoryChangedEvent.Kind.STORED);
    }

    public Result<Memory> get(String id) {
        if (closed) {
            return closedError();
        }
        try {
            Optional<Memory> memory = storage.get(sessionId, id);
            return memory.map(this::detached).map(Result::ok).orElseGet(() -> notFound(id));
        } catch (SessionException e) {
            return e.toResult();
        }
    }

    /**
     * Memories matching every set criterion, oldest first, truncated to the
     * filter limit.
     */
    public Result<List<Memory>> query(MemoryFilter filter) {
        if (closed) {
            return closedError();
        }
        MemoryFilter effective = filter != null ? filter : MemoryFilter.all();
        try {
            List<Memory> matches = storage.scan(sessionId).stream()
                    .filter(effective::matches)
                    .sorted(CREATION_ORDER)
                    .map(this::detached)
                    .toList();
            if (effective.getLimit() != null && effective.getLimit() >= 0
                    && matches.size() > effective.getLimit()) {
                matches = matches.subList(0, effective.getLimit());
            }
            return Result.ok(matches);
        } catch (SessionException e) {
            return e.toResult();
        }
    }

    /**
     * Merges {@code patch} into an existing memory. {@code createdAt} is kept.
     */
    public synchronized Result<Memory> update(String id, MemoryPatch patch) {
        if (closed) {
            return closedError();
        }
        Result<Memory> existing = get(id);
        if (!existing.isSuccess()) {
            return existing;
        }
        Memory current = existing.getValue();
        Memory.MemoryBuilder builder = current.toBuilder();
        if (patch != null) {
            if (patch.getType() != null) {
                builder.type(patch.getType());
            }
            if (patch.getData() != null) {
                Result<Void> checked = checkSize(patch.getData());
                if (!checked.isSuccess()) {
                    return checked.propagate();
                }
                Result<Object> data = copyData(patch.getData());
                if (!data.isSuccess()) {
                    return data.propagate();
                }
                builder.data(data.getValue());
            }
            if (patch.getImportance() != null) {
                Result<Void> checked = checkImportance(patch.getImportance());
                if (!checked.isSuccess()) {
                    return checked.propagate();
                }
                builder.importance(patch.getImportance());
            }
        }
        Memory updated = builder
                .id(current.getId())
                .sessionId(sessionId)
                .createdAt(current.getCreatedAt())
                .updatedAt(clock.instant())
                .build();
        return write(updated, MemoryChangedEvent.Kind.UPDATED);
    }

    public synchronized Result<Void> delete(String id) {
        if (closed) {
            return closedError();
        }
        try {
            Optional<Memory> existing = storage.get(sessionId, id);
            if (existing.isEmpty() || !storage.delete(sessionId, id)) {
                return notFound(id);
            }
            changeListener.accept(new MemoryChangedEvent(sessionId, id, existing.get().getType(),
                    MemoryChangedEvent.Kind.DELETED));
            return Result.ok(null);
        } catch (SessionException e) {
            return e.toResult();
        }
    }

    public Result<Integer> count() {
        if (closed) {
            return closedError();
        }
        try {
            return Result.ok(storage.scan(sessionId).size());
        } catch (SessionException e) {
            return e.toResult();
        }
    }

    /**
     * Removes all memories of this session only.
     *
     * @return number of memories removed
     */
    public synchronized Result<Integer> clear() {
        if (closed) {
            return closedError();
        }
        try {
            int removed = storage.deletePartition(sessionId);
            changeListener.accept(new MemoryChangedEvent(sessionId, null, null, MemoryChangedEvent.Kind.CLEARED));
            log.debug("[LTM] Cleared {} memories of {}", removed, sessionId);
            return Result.ok(removed);
        } catch (SessionException e) {
            return e.toResult();
        }
    }

    public void close() {
        closed = true;
    }

    private Result<Memory> write(Memory memory, MemoryChangedEvent.Kind kind) {
        try {
            storage.put(sessionId, memory);
        } catch (SessionException e) {
            log.error("[LTM] Write of {} for {} failed: {}", memory.getId(), sessionId, e.getMessage());
            return e.toResult();
        } catch (RuntimeException e) { // NOSONAR
            log.error("[LTM] Write of {} for {} failed", memory.getId(), sessionId, e);
            return Result.error(ErrorCode.STORAGE_FAILURE, "Failed to store memory " + memory.getId(),
                    Map.of("memory_id", memory.getId()));
        }
        changeListener.accept(new MemoryChangedEvent(sessionId, memory.getId(), memory.getType(), kind));
        return Result.ok(detached(memory));
    }

    private Memory detached(Memory memory) {
        if (memory.getData() == null) {
            return memory.toBuilder().build();
        }
        return memory.toBuilder()
                .data(objectMapper.convertValue(memory.getData(), Object.class))
                .build();
    }

    private Result<Object> copyData(Object data) {
        if (data == null) {
            return Result.ok(null);
        }
        try {
            return Result.ok(objectMapper.convertValue(data, Object.class));
        } catch (IllegalArgumentException e) {
            return Result.error(ErrorCode.INVALID_TYPE, "Memory data is not serializable: " + e.getMessage(),
                    Map.of("field", "data"));
        }
    }

    private Result<Void> checkImportance(double importance) {
        if (importance < 0.0 || importance > 1.0) {
            return Result.error(ErrorCode.INVALID_IMPORTANCE, "Importance must be within [0, 1]",
                    Map.of("field", "importance", "value", importance));
        }
        return Result.ok(null);
    }

    private Result<Void> checkSize(Object data) {
        if (data == null || maxDataBytes <= 0) {
            return Result.ok(null);
        }
        try {
            int size = objectMapper.writeValueAsBytes(data).length;
            if (size > maxDataBytes) {
                return Result.error(ErrorCode.DATA_TOO_LARGE,
                        "Memory data is " + size + " bytes, limit is " + maxDataBytes,
                        Map.of("field", "data", "size", size, "max_size", maxDataBytes));
            }
            return Result.ok(null);
        } catch (JsonProcessingException e) {
            return Result.error(ErrorCode.INVALID_TYPE, "Memory data is not serializable: " + e.getMessage(),
                    Map.of("field", "data"));
        }
    }

    private <T> Result<T> notFound(String id) {
        return Result.error(ErrorCode.MEMORY_NOT_FOUND, "Memory not found: " + id,
                Map.of("memory_id", id != null ? id : ""));
    }

    private <T> Result<T> closedError() {
        return Result.error(ErrorCode.HANDLE_CLOSED, "Long-term memory handle of " + sessionId + " is closed",
                Map.of("session_id", sessionId));
    }
}
