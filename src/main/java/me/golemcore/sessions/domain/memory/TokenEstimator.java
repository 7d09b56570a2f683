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

import me.golemcore.sessions.domain.model.MessageRole;

/**
 * Character-based token estimation (~4 characters per token).
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;
    private static final int MESSAGE_OVERHEAD_TOKENS = 4;

    private TokenEstimator() {
    }

    /**
     * Estimates tokens for text; never returns less than 1.
     */
    public static int estimateTokens(String text) {
        if (text == null) {
            return 1;
        }
        return Math.max(1, text.length() / CHARS_PER_TOKEN);
    }

    /**
     * Estimates tokens for a message: role, content and per-message framing.
     */
    public static int estimateMessageTokens(MessageRole role, String content) {
        String roleText = role != null ? role.value() : "";
        return estimateTokens(roleText) + estimateTokens(content) + MESSAGE_OVERHEAD_TOKENS;
    }
}
