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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sessions.domain.model.Memory;
import me.golemcore.sessions.port.outbound.LongTermStoragePort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed long-term storage. Records survive session termination but not
 * a process restart. Records are deep-copied on every put and read.
 */
public class InMemoryLongTermStorageAdapter implements LongTermStoragePort {

    private final Map<String, Map<String, Memory>> partitions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryLongTermStorageAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void put(String partition, Memory memory) {
        partitions.computeIfAbsent(partition, k -> new ConcurrentHashMap<>())
                .put(memory.getId(), copy(memory));
    }

    @Override
    public Optional<Memory> get(String partition, String id) {
        Map<String, Memory> records = partitions.get(partition);
        if (records == null) {
            return Optional.empty();
        }
        Memory memory = records.get(id);
        return memory != null ? Optional.of(copy(memory)) : Optional.empty();
    }

    @Override
    public boolean delete(String partition, String id) {
        Map<String, Memory> records = partitions.get(partition);
        return records != null && records.remove(id) != null;
    }

    @Override
    public List<Memory> scan(String partition) {
        Map<String, Memory> records = partitions.get(partition);
        if (records == null) {
            return List.of();
        }
        List<Memory> copies = new ArrayList<>(records.size());
        records.values().forEach(m -> copies.add(copy(m)));
        return copies;
    }

    @Override
    public int deletePartition(String partition) {
        Map<String, Memory> removed = partitions.remove(partition);
        return removed != null ? removed.size() : 0;
    }

    private Memory copy(Memory memory) {
        if (memory.getData() == null) {
            return memory.toBuilder().build();
        }
        return memory.toBuilder()
                .data(objectMapper.convertValue(memory.getData(), Object.class))
                .build();
    }
}
