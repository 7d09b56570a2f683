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

import me.golemcore.sessions.domain.model.Message;
import me.golemcore.sessions.domain.model.TokenBudget;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Token-budgeted, oldest-first conversation buffer.
 *
 * <p>
 * After every mutation the retained tokens stay within
 * {@link TokenBudget#overheadLimit()} and the message count within
 * {@code maxMessages}. The token total is maintained incrementally; evicting
 * a message subtracts its cached estimate.
 *
 * <p>
 * Not thread-safe. Owned by a single session worker.
 */
public class ConversationBuffer {

    public static final int DEFAULT_MAX_MESSAGES = 100;

    private final TokenBudget budget;
    private final int maxMessages;
    private final Deque<Message> messages = new ArrayDeque<>();
    private int totalTokens;

    public ConversationBuffer(TokenBudget budget, int maxMessages) {
        budget.validate();
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive: " + maxMessages);
        }
        this.budget = budget;
        this.maxMessages = maxMessages;
    }

    public ConversationBuffer() {
        this(TokenBudget.defaults(), DEFAULT_MAX_MESSAGES);
    }

    /**
     * Appends a message and evicts the oldest messages until the buffer is back
     * within budget. A message larger than the whole budget is evicted as well.
     *
     * @return the stored message and the evicted messages, oldest first
     */
    public AddResult add(Message message) {
        if (message == null || message.getRole() == null) {
            throw new IllegalArgumentException("Message with a role is required");
        }
        Message stored = message.getEstimatedTokens() > 0
                ? message
                : message.toBuilder()
                        .estimatedTokens(TokenEstimator.estimateMessageTokens(message.getRole(), message.getContent()))
                        .build();
        messages.addLast(stored);
        totalTokens += stored.getEstimatedTokens();

        List<Message> evicted = new ArrayList<>();
        while (!messages.isEmpty() && (budget.shouldEvict(totalTokens) || messages.size() > maxMessages)) {
            evicted.add(evictOldest());
        }
        return new AddResult(stored, evicted);
    }

    /**
     * Last {@code n} messages in chronological order.
     */
    public List<Message> recent(int n) {
        if (n <= 0) {
            return List.of();
        }
        int skip = Math.max(0, messages.size() - n);
        List<Message> result = new ArrayList<>(Math.min(n, messages.size()));
        Iterator<Message> it = messages.iterator();
        int index = 0;
        while (it.hasNext()) {
            Message m = it.next();
            if (index++ >= skip) {
                result.add(m);
            }
        }
        return result;
    }

    public List<Message> all() {
        return new ArrayList<>(messages);
    }

    public int count() {
        return messages.size();
    }

    public int tokenCount() {
        return totalTokens;
    }

    public TokenBudget budget() {
        return budget;
    }

    public int maxMessages() {
        return maxMessages;
    }

    /**
     * Evicts the oldest messages until the retained tokens are at most
     * {@code targetTokens}.
     */
    public List<Message> trimToTokens(int targetTokens) {
        List<Message> evicted = new ArrayList<>();
        while (!messages.isEmpty() && totalTokens > targetTokens) {
            evicted.add(evictOldest());
        }
        return evicted;
    }

    /**
     * Keeps only the newest {@code count} messages.
     */
    public List<Message> trimToCount(int count) {
        List<Message> evicted = new ArrayList<>();
        int keep = Math.max(0, count);
        while (messages.size() > keep) {
            evicted.add(evictOldest());
        }
        return evicted;
    }

    public void clear() {
        messages.clear();
        totalTokens = 0;
    }

    public Optional<Message> find(Predicate<Message> predicate) {
        return messages.stream().filter(predicate).findFirst();
    }

    /**
     * Result of {@link #add(Message)}.
     */
    public record AddResult(Message message, List<Message> evicted) {
    }

    private Message evictOldest() {
        Message oldest = messages.pollFirst();
        totalTokens -= oldest.getEstimatedTokens();
        return oldest;
    }
}
