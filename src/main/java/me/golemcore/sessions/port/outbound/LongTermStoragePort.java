package me.golemcore.sessions.port.outbound;

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

import me.golemcore.sessions.domain.model.Memory;

import java.util.List;
import java.util.Optional;

/**
 * Partitioned backend for long-term memories. A partition holds the records
 * of exactly one session; operations never cross partitions.
 *
 * <p>
 * Implementations signal backend faults with
 * {@link me.golemcore.sessions.domain.model.SessionException} carrying
 * {@code STORAGE_FAILURE}.
 */
public interface LongTermStoragePort {

    void put(String partition, Memory memory);

    Optional<Memory> get(String partition, String id);

    boolean delete(String partition, String id);

    List<Memory> scan(String partition);

    /**
     * Removes every record of the partition.
     *
     * @return number of records removed
     */
    int deletePartition(String partition);
}
