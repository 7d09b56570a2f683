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

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.model.Message;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.domain.model.MessageRole;
import me.golemcore.sessions.domain.model.PendingMemoryItem;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.domain.model.TokenBudget;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Short-term memory of one session: conversation buffer, working context and
 * pending-promotion queue.
 *
 * <p>
 * Every operation records an access timestamp (the last
 * {@value #ACCESS_LOG_SIZE} are kept). When {@code promoteEvicted} is set,
 * messages evicted from the conversation buffer are queued as conversation
 * memories.
 *
 * <p>
 * Not thread-safe. All calls for a session are serialized by its
 * {@link me.golemcore.sessions.domain.session.SessionUnit}.
 */
@Slf4j
public class ShortTermMemory {

    static final int ACCESS_LOG_SIZE = 1000;

    private final String sessionId;
    private final Clock clock;
    private final ConversationBuffer conversation;
    private final WorkingContext context;
    private final PendingQueue pending;
    private final boolean promoteEvicted;
    private final Deque<Instant> accessLog = new ArrayDeque<>();

    public ShortTermMemory(String sessionId, Clock clock, Limits limits) {
        this.sessionId = sessionId;
        this.clock = clock;
        this.conversation = new ConversationBuffer(limits.getBudget(), limits.getMaxMessages());
        this.context = new WorkingContext(clock, limits.getMaxContextItems());
        this.pending = new PendingQueue(clock, limits.getMaxPending());
        this.promoteEvicted = limits.isPromoteEvicted();
    }

    public ShortTermMemory(String sessionId, Clock clock) {
        this(sessionId, clock, Limits.builder().build());
    }

    // ===== Conversation =====

    public ConversationBuffer.AddResult addMessage(MessageRole role, String content) {
        Instant now = recordAccess();
        Message message = Message.builder()
                .role(role)
                .content(content)
                .timestamp(now)
                .estimatedTokens(TokenEstimator.estimateMessageTokens(role, content))
                .build();
        ConversationBuffer.AddResult result = conversation.add(message);
        List<Message> evicted = result.evicted();
        if (!evicted.isEmpty()) {
            log.debug("[STM] {} evicted {} message(s), tokens now {}", sessionId, evicted.size(),
                    conversation.tokenCount());
            if (promoteEvicted) {
                queueEvicted(evicted);
            }
        }
        return result;
    }

    public List<Message> recentMessages(int n) {
        recordAccess();
        return conversation.recent(n);
    }

    public List<Message> allMessages() {
        recordAccess();
        return conversation.all();
    }

    public int messageCount() {
        return conversation.count();
    }

    public int tokenCount() {
        return conversation.tokenCount();
    }

    public void clearConversation() {
        recordAccess();
        conversation.clear();
    }

    public List<Message> trimConversation(int targetTokens) {
        recordAccess();
        return conversation.trimToTokens(targetTokens);
    }

    // ===== Working context =====

    public Optional<String> putContext(String key, Object value) {
        recordAccess();
        return context.put(key, value);
    }

    public List<String> putContextMany(Map<String, Object> values) {
        recordAccess();
        return context.putMany(values);
    }

    public Object getContext(String key, Object defaultValue) {
        recordAccess();
        return context.get(key, defaultValue);
    }

    public boolean deleteContext(String key) {
        recordAccess();
        return context.delete(key);
    }

    public Map<String, Object> listContext() {
        recordAccess();
        return context.list();
    }

    public List<String> contextKeys() {
        return context.keys();
    }

    public void clearContext() {
        recordAccess();
        context.clear();
    }

    // ===== Pending memories =====

    public Result<PendingMemoryItem> enqueueMemory(PendingMemoryItem item) {
        recordAccess();
        return pending.enqueue(item);
    }

    public Result<PendingMemoryItem> dequeueMemory() {
        recordAccess();
        return pending.dequeue();
    }

    public Optional<PendingMemoryItem> peekPendingMemory() {
        return pending.peek();
    }

    public int pendingCount() {
        return pending.size();
    }

    public PendingQueue pendingQueue() {
        return pending;
    }

    public WorkingContext workingContext() {
        return context;
    }

    public ConversationBuffer conversationBuffer() {
        return conversation;
    }

    // ===== Introspection =====

    public boolean isEmpty() {
        return conversation.count() == 0 && context.count() == 0 && pending.isEmpty();
    }

    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("session_id", sessionId);
        summary.put("message_count", conversation.count());
        summary.put("token_count", conversation.tokenCount());
        summary.put("max_tokens", conversation.budget().getMaxTokens());
        summary.put("token_limit", conversation.budget().overheadLimit());
        summary.put("context_items", context.count());
        summary.put("max_context_items", context.maxItems());
        summary.put("pending_count", pending.size());
        summary.put("max_pending", pending.maxSize());
        summary.put("access_count", accessLog.size());
        summary.put("last_accessed", accessLog.peekLast());
        return summary;
    }

    public String sessionId() {
        return sessionId;
    }

    private void queueEvicted(List<Message> evicted) {
        for (Message message : evicted) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("role", message.getRole().value());
            data.put("content", message.getContent());
            data.put("timestamp", message.getTimestamp() != null ? message.getTimestamp().toString() : null);
            PendingMemoryItem item = PendingMemoryItem.builder()
                    .id("evicted_" + UUID.randomUUID())
                    .type(MemoryType.CONVERSATION)
                    .data(data)
                    .build();
            Result<PendingMemoryItem> result = pending.enqueue(item);
            if (!result.isSuccess()) {
                log.warn("[STM] {} could not queue evicted message: {}", sessionId, result.getMessage());
            }
        }
    }

    private Instant recordAccess() {
        Instant now = clock.instant();
        accessLog.addLast(now);
        if (accessLog.size() > ACCESS_LOG_SIZE) {
            accessLog.pollFirst();
        }
        return now;
    }

    /**
     * Capacity settings for a session's short-term memory.
     */
    @Data
    @Builder
    public static class Limits {

        @Builder.Default
        private TokenBudget budget = TokenBudget.defaults();

        @Builder.Default
        private int maxMessages = ConversationBuffer.DEFAULT_MAX_MESSAGES;

        @Builder.Default
        private int maxContextItems = WorkingContext.DEFAULT_MAX_ITEMS;

        @Builder.Default
        private int maxPending = PendingQueue.DEFAULT_MAX_SIZE;

        @Builder.Default
        private boolean promoteEvicted = false;
    }
}
