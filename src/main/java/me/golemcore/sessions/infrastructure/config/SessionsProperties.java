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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration of the session runtime, bound from application.properties.
 *
 * <p>
 * Organized under the {@code sessions.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link MemoryProperties} - short-term limits and long-term backend</li>
 * <li>{@link PromotionProperties} - promotion criteria and schedule</li>
 * <li>{@link RetrievalProperties} - search defaults and result cache</li>
 * <li>{@link LifecycleProperties} - allocation timeout, reaping, idle
 * sweep</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "sessions")
@Data
public class SessionsProperties {

    private StorageProperties storage = new StorageProperties();
    private MemoryProperties memory = new MemoryProperties();
    private PromotionProperties promotion = new PromotionProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private LifecycleProperties lifecycle = new LifecycleProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String sessionsDirectory = "sessions";
        private String memoryDirectory = "memory";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/sessions-workspace";
    }

    @Data
    public static class MemoryProperties {
        private int maxTokens = 4000;
        private double reservePercentage = 0.1;
        private double overheadThreshold = 0.9;
        private int maxMessages = 100;
        private int maxContextItems = 50;
        private int maxPending = 20;
        private boolean promoteEvicted = false;
        private LongTermProperties longTerm = new LongTermProperties();
    }

    @Data
    public static class LongTermProperties {
        private String backend = "memory";
        private int maxDataBytes = 100 * 1024;
    }

    @Data
    public static class PromotionProperties {
        private double minImportance = 0.5;
        private Long maxAgeSeconds = 300L;
        private double minConfidence = 0.3;
        private int batchSize = 10;
        private int maxIterations = 100;
        private boolean inferTypes = true;
        private long intervalSeconds = 0;
    }

    @Data
    public static class RetrievalProperties {
        private boolean cacheEnabled = true;
        private long cacheTtlMinutes = 5;
        private int cacheMaxSize = 100;
        private int defaultLimit = 10;
        private int defaultMaxTokens = 2000;
    }

    @Data
    public static class LifecycleProperties {
        private long allocationTimeoutMs = 5000;
        private long reapDelayMs = 50;
        private long idleCheckIntervalSeconds = 60;
    }
}
