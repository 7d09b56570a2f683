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

import jakarta.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors shared by the session runtime: a pool that allocates session
 * resources under a timeout, and a scheduler for delayed reaping and periodic
 * maintenance. Per-session workers are owned by each session unit.
 */
@Configuration
public class SessionExecutorConfiguration {

    private ExecutorService allocationExecutor;
    private ScheduledExecutorService scheduler;

    @Bean(name = "sessionAllocationExecutor")
    public synchronized ExecutorService sessionAllocationExecutor() {
        if (allocationExecutor == null) {
            allocationExecutor = Executors.newCachedThreadPool(daemonFactory("session-alloc"));
        }
        return allocationExecutor;
    }

    @Bean(name = "sessionScheduler")
    public synchronized ScheduledExecutorService sessionScheduler() {
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(daemonFactory("session-scheduler"));
        }
        return scheduler;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (allocationExecutor != null) {
            allocationExecutor.shutdownNow();
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
