package me.golemcore.sessions.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token budget of a conversation buffer.
 *
 * <p>
 * {@code reservePercentage} of {@code maxTokens} is held back for the model's
 * response, and eviction starts once the retained tokens exceed
 * {@code maxTokens * overheadThreshold}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenBudget {

    public static final int DEFAULT_MAX_TOKENS = 4000;
    public static final double DEFAULT_RESERVE_PERCENTAGE = 0.1;
    public static final double DEFAULT_OVERHEAD_THRESHOLD = 0.9;

    @Builder.Default
    private int maxTokens = DEFAULT_MAX_TOKENS;

    @Builder.Default
    private double reservePercentage = DEFAULT_RESERVE_PERCENTAGE;

    @Builder.Default
    private double overheadThreshold = DEFAULT_OVERHEAD_THRESHOLD;

    public static TokenBudget defaults() {
        return TokenBudget.builder().build();
    }

    /**
     * Tokens usable for context once the response reserve is subtracted.
     */
    public int available() {
        return maxTokens - (int) (maxTokens * reservePercentage);
    }

    /**
     * Highest token count the buffer may retain.
     */
    public int overheadLimit() {
        return (int) (maxTokens * overheadThreshold);
    }

    public boolean shouldEvict(int currentTokens) {
        return currentTokens > overheadLimit();
    }

    public int evictionNeeded(int currentTokens) {
        return Math.max(currentTokens - overheadLimit(), 0);
    }

    public boolean wouldExceed(int currentTokens, int tokensToAdd) {
        return currentTokens + tokensToAdd > available();
    }

    /**
     * Rejects budgets that cannot hold anything.
     *
     * @throws IllegalArgumentException
     *             if a limit is out of range
     */
    public void validate() {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (reservePercentage < 0.0 || reservePercentage >= 1.0) {
            throw new IllegalArgumentException("reservePercentage must be in [0, 1): " + reservePercentage);
        }
        if (overheadThreshold <= 0.0 || overheadThreshold > 1.0) {
            throw new IllegalArgumentException("overheadThreshold must be in (0, 1]: " + overheadThreshold);
        }
    }
}
