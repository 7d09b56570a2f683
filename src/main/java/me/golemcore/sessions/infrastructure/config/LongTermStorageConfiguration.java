package me.golemcore.sessions.infrastructure.config;

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
import me.golemcore.sessions.adapter.outbound.memory.InMemoryLongTermStorageAdapter;
import me.golemcore.sessions.adapter.outbound.memory.StorageLongTermStorageAdapter;
import me.golemcore.sessions.port.outbound.LongTermStoragePort;
import me.golemcore.sessions.port.outbound.StoragePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the long-term storage backend from
 * {@code sessions.memory.long-term.backend} ({@code memory} or
 * {@code storage}).
 */
@Configuration
@Slf4j
public class LongTermStorageConfiguration {

    @Bean
    public LongTermStoragePort longTermStoragePort(SessionsProperties properties, StoragePort storagePort,
            ObjectMapper objectMapper) {
        String backend = properties.getMemory().getLongTerm().getBackend();
        String normalized = backend != null ? backend.trim().toLowerCase(Locale.ROOT) : "memory";
        switch (normalized) {
        case "memory":
            log.info("[LTM] Using in-memory long-term storage");
            return new InMemoryLongTermStorageAdapter(objectMapper);
        case "storage":
            log.info("[LTM] Using workspace long-term storage in '{}'",
                    properties.getStorage().getMemoryDirectory());
            return new StorageLongTermStorageAdapter(storagePort, objectMapper,
                    properties.getStorage().getMemoryDirectory());
        default:
            throw new IllegalStateException("Unknown long-term storage backend: " + backend);
        }
    }
}
