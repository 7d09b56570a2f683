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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping: moves stale sessions to IDLE and, when
 * {@code sessions.promotion.interval-seconds} is positive, runs promotion
 * cycles for all live sessions.
 */
@Service
@Slf4j
public class SessionMaintenanceService {

    private final SessionLifecycleService lifecycleService;
    private final SessionsProperties properties;
    private final ScheduledExecutorService sessionScheduler;
    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

    public SessionMaintenanceService(SessionLifecycleService lifecycleService, SessionsProperties properties,
            ScheduledExecutorService sessionScheduler) {
        this.lifecycleService = lifecycleService;
        this.properties = properties;
        this.sessionScheduler = sessionScheduler;
    }

    @PostConstruct
    public void start() {
        long idleInterval = properties.getLifecycle().getIdleCheckIntervalSeconds();
        if (idleInterval > 0) {
            tasks.add(sessionScheduler.scheduleWithFixedDelay(this::runIdleSweep, idleInterval, idleInterval,
                    TimeUnit.SECONDS));
        }
        long promotionInterval = properties.getPromotion().getIntervalSeconds();
        if (promotionInterval > 0) {
            tasks.add(sessionScheduler.scheduleWithFixedDelay(this::runPromotion, promotionInterval,
                    promotionInterval, TimeUnit.SECONDS));
            log.info("[Maintenance] Promotion sweep every {}s", promotionInterval);
        }
    }

    @PreDestroy
    public void stop() {
        tasks.forEach(task -> task.cancel(false));
        tasks.clear();
    }

    void runIdleSweep() {
        try {
            lifecycleService.sweepIdle();
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Maintenance] Idle sweep failed", e);
        }
    }

    void runPromotion() {
        try {
            int promoted = lifecycleService.promotePending();
            if (promoted > 0) {
                log.info("[Maintenance] Promoted {} memories", promoted);
            }
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Maintenance] Promotion sweep failed", e);
        }
    }
}
