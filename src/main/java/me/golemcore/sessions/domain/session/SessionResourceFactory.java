package me.golemcore.sessions.domain.session;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.memory.LongTermStore;
import me.golemcore.sessions.domain.memory.ShortTermMemory;
import me.golemcore.sessions.domain.model.TokenBudget;
import me.golemcore.sessions.domain.service.LongTermMemoryService;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Allocates and releases the per-session resources.
 */
@Component
@Slf4j
public class SessionResourceFactory {

    private final SessionsProperties properties;
    private final Clock clock;
    private final LongTermMemoryService longTermMemoryService;

    public SessionResourceFactory(SessionsProperties properties, Clock clock,
            LongTermMemoryService longTermMemoryService) {
        this.properties = properties;
        this.clock = clock;
        this.longTermMemoryService = longTermMemoryService;
    }

    /**
     * Opens the long-term handle and starts a unit around a fresh short-term
     * memory.
     *
     * @throws me.golemcore.sessions.domain.model.SessionException
     *             if the long-term handle cannot be opened
     */
    public SessionResources allocate(String sessionId) {
        LongTermStore longTermStore = longTermMemoryService.open(sessionId).orElseThrow();
        ShortTermMemory shortTermMemory = new ShortTermMemory(sessionId, clock, limits());
        SessionUnit unit = new SessionUnit(sessionId, shortTermMemory,
                properties.getLifecycle().getAllocationTimeoutMs());
        log.debug("[Lifecycle] Allocated resources for {}", sessionId);
        return new SessionResources(unit, longTermStore);
    }

    /**
     * Stops the unit (dropping short-term memory) and closes the long-term
     * handle. Long-term records are kept.
     */
    public void release(String sessionId, SessionResources resources) {
        if (resources != null && resources.unit() != null) {
            resources.unit().stop();
        }
        longTermMemoryService.close(sessionId);
    }

    ShortTermMemory.Limits limits() {
        SessionsProperties.MemoryProperties memory = properties.getMemory();
        TokenBudget budget = TokenBudget.builder()
                .maxTokens(memory.getMaxTokens())
                .reservePercentage(memory.getReservePercentage())
                .overheadThreshold(memory.getOverheadThreshold())
                .build();
        return ShortTermMemory.Limits.builder()
                .budget(budget)
                .maxMessages(memory.getMaxMessages())
                .maxContextItems(memory.getMaxContextItems())
                .maxPending(memory.getMaxPending())
                .promoteEvicted(memory.isPromoteEvicted())
                .build();
    }
}
