package me.golemcore.sessions.adapter.outbound.memory;

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
import me.golemcore.sessions.domain.model.SessionException;
import me.golemcore.sessions.port.outbound.LongTermStoragePort;
import me.golemcore.sessions.port.outbound.StoragePort;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Long-term storage persisted as JSON files in the workspace, one file per
 * memory under {@code <memoryDir>/<sessionId>/<memoryId>.json} (memory id
 * URL-encoded).
 */
@Slf4j
public class StorageLongTermStorageAdapter implements LongTermStoragePort {

    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;

    public StorageLongTermStorageAdapter(StoragePort storagePort, ObjectMapper objectMapper, String directory) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = directory;
    }

    @Override
    public void put(String partition, Memory memory) {
        try {
            String json = objectMapper.writeValueAsString(memory);
            storagePort.putTextAtomic(directory, path(partition, memory.getId()), json, false).join();
        } catch (JsonProcessingException | CompletionException e) {
            throw new SessionException(ErrorCode.STORAGE_FAILURE,
                    "Failed to store memory " + memory.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Memory> get(String partition, String id) {
        try {
            String json = storagePort.getText(directory, path(partition, id)).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, Memory.class));
        } catch (JsonProcessingException | CompletionException e) {
            throw new SessionException(ErrorCode.STORAGE_FAILURE,
                    "Failed to read memory " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String partition, String id) {
        try {
            String file = path(partition, id);
            boolean existed = Boolean.TRUE.equals(storagePort.exists(directory, file).join());
            if (existed) {
                storagePort.deleteObject(directory, file).join();
            }
            return existed;
        } catch (CompletionException e) {
            throw new SessionException(ErrorCode.STORAGE_FAILURE,
                    "Failed to delete memory " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Memory> scan(String partition) {
        List<String> files;
        try {
            files = storagePort.listObjects(directory, partition).join();
        } catch (CompletionException e) {
            throw new SessionException(ErrorCode.STORAGE_FAILURE,
                    "Failed to list memories of " + partition + ": " + e.getMessage(), e);
        }
        List<Memory> memories = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            try {
                String json = storagePort.getText(directory, file).join();
                if (json != null && !json.isBlank()) {
                    memories.add(objectMapper.readValue(json, Memory.class));
                }
            } catch (JsonProcessingException | CompletionException e) { // NOSONAR
                log.warn("[LTM] Skipping unreadable memory file {}/{}: {}", directory, file, e.getMessage());
            }
        }
        return memories;
    }

    @Override
    public int deletePartition(String partition) {
        List<Memory> existing = scan(partition);
        int removed = 0;
        for (Memory memory : existing) {
            if (delete(partition, memory.getId())) {
                removed++;
            }
        }
        return removed;
    }

    private static String path(String partition, String id) {
        return partition + "/" + URLEncoder.encode(id, StandardCharsets.UTF_8) + JSON_EXTENSION;
    }
}
