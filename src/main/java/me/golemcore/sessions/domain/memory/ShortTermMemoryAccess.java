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

import java.util.function.Function;

/**
 * Serialized access to a session's {@link ShortTermMemory}. Each action runs
 * alone: no other action on the same memory interleaves with it.
 */
public interface ShortTermMemoryAccess {

    <T> T withShortTermMemory(Function<ShortTermMemory, T> action);

    /**
     * Access that runs actions on the calling thread, serialized by a monitor.
     */
    static ShortTermMemoryAccess direct(ShortTermMemory memory) {
        return new ShortTermMemoryAccess() {
            @Override
            public synchronized <T> T withShortTermMemory(Function<ShortTermMemory, T> action) {
                return action.apply(memory);
            }
        };
    }
}
