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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.memory.ConversationBuffer;
import me.golemcore.sessions.domain.memory.LongTermStore;
import me.golemcore.sessions.domain.memory.ShortTermMemory;
import me.golemcore.sessions.domain.model.CreateSessionOptions;
import me.golemcore.sessions.domain.model.EnrichOptions;
import me.golemcore.sessions.domain.model.EnrichedContext;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.Message;
import me.golemcore.sessions.domain.model.MessageRole;
import me.golemcore.sessions.domain.model.PendingMemoryItem;
import me.golemcore.sessions.domain.model.PromotionOptions;
import me.golemcore.sessions.domain.model.PromotionResult;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.domain.model.RetrievalQuery;
import me.golemcore.sessions.domain.model.SavedSession;
import me.golemcore.sessions.domain.model.ScoredMemory;
import me.golemcore.sessions.domain.model.SessionEventType;
import me.golemcore.sessions.domain.model.SessionException;
import me.golemcore.sessions.domain.model.SessionState;
import me.golemcore.sessions.domain.model.SessionStatus;
import me.golemcore.sessions.domain.model.SessionUpdate;
import me.golemcore.sessions.domain.session.SessionEntry;
import me.golemcore.sessions.domain.session.SessionRegistry;
import me.golemcore.sessions.domain.session.SessionResourceFactory;
import me.golemcore.sessions.domain.session.SessionResources;
import me.golemcore.sessions.domain.session.SessionUnit;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Creates, supervises and terminates sessions.
 *
 * <p>
 * Each session gets a {@link SessionUnit} owning its short-term memory and a
 * long-term memory handle. The service watches every unit's exit future: an
 * abnormal exit moves that session to TERMINATED with its error recorded and
 * leaves every other session untouched. Terminated sessions stay listed until
 * they are reaped after {@code sessions.lifecycle.reap-delay-ms}.
 *
 * <p>
 * All operations return {@link Result}s; failures of one session are never
 * thrown to the caller.
 */
@Service
@Slf4j
public class SessionLifecycleService {

    static final String SESSION_PREFIX = "session_";

    private final SessionRegistry registry;
    private final SessionResourceFactory resourceFactory;
    private final SessionEventPublisher eventPublisher;
    private final MemoryPromotionService promotionService;
    private final MemoryRetrievalService retrievalService;
    private final SessionPersistenceService persistenceService;
    private final SessionsProperties properties;
    private final Clock clock;
    private final ExecutorService sessionAllocationExecutor;
    private final ScheduledExecutorService sessionScheduler;

    public SessionLifecycleService(SessionRegistry registry, SessionResourceFactory resourceFactory,
            SessionEventPublisher eventPublisher, MemoryPromotionService promotionService,
            MemoryRetrievalService retrievalService, SessionPersistenceService persistenceService,
            SessionsProperties properties, Clock clock, ExecutorService sessionAllocationExecutor,
            ScheduledExecutorService sessionScheduler) {
        this.registry = registry;
        this.resourceFactory = resourceFactory;
        this.eventPublisher = eventPublisher;
        this.promotionService = promotionService;
        this.retrievalService = retrievalService;
        this.persistenceService = persistenceService;
        this.properties = properties;
        this.clock = clock;
        this.sessionAllocationExecutor = sessionAllocationExecutor;
        this.sessionScheduler = sessionScheduler;
    }

    // ==================== lifecycle ====================

    /**
     * Creates a session and allocates its memories within the allocation
     * timeout.
     *
     * @return the new session id; {@code timeout} when allocation is too slow
     *         (nothing stays registered), or the allocation error (the session
     *         is kept as TERMINATED with the error until reaped)
     */
    public Result<String> create(CreateSessionOptions options) {
        CreateSessionOptions opts = options != null ? options : CreateSessionOptions.defaults();
        String sessionId = SESSION_PREFIX + UUID.randomUUID();
        SessionState state = SessionState.initializing(sessionId, opts.getConfig(), opts.getLlmConfig(),
                opts.getMetadata(), clock.instant());
        registry.register(new SessionEntry(state));

        CompletableFuture<SessionResources> allocation;
        try {
            allocation = CompletableFuture.supplyAsync(() -> resourceFactory.allocate(sessionId),
                    sessionAllocationExecutor);
        } catch (RejectedExecutionException e) {
            registry.remove(sessionId);
            return Result.error(ErrorCode.SESSION_UNAVAILABLE, "Session runtime is shutting down");
        }

        SessionResources resources;
        long timeoutMs = properties.getLifecycle().getAllocationTimeoutMs();
        try {
            resources = allocation.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            rollback(sessionId, allocation);
            log.warn("[Lifecycle] Allocation of {} timed out after {} ms", sessionId, timeoutMs);
            return Result.error(ErrorCode.TIMEOUT, "Session allocation timed out after " + timeoutMs + " ms",
                    Map.of("timeout_ms", timeoutMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rollback(sessionId, allocation);
            return Result.error(ErrorCode.SESSION_UNAVAILABLE, "Interrupted while creating session");
        } catch (ExecutionException e) {
            return failAllocation(sessionId, e.getCause());
        }

        Instant now = clock.instant();
        Result<SessionStatus> activated = registry.update(sessionId, entry -> {
            entry.attach(resources.unit(), resources.longTermStore());
            return entry.state().transitionTo(SessionStatus.ACTIVE, now);
        }).orElseGet(() -> Result.error(ErrorCode.SESSION_NOT_FOUND, "Session vanished during creation"));
        if (!activated.isSuccess()) {
            resourceFactory.release(sessionId, resources);
            return activated.propagate();
        }

        monitor(sessionId, resources.unit());
        emitStatus(sessionId, SessionStatus.INITIALIZING, SessionStatus.ACTIVE, now);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("metadata", new LinkedHashMap<>(state.getMetadata()));
        eventPublisher.emit(SessionEventType.SESSION_CREATED, sessionId, payload);
        log.info("[Lifecycle] Created session {}", sessionId);
        return Result.ok(sessionId);
    }

    /**
     * Terminates a live session: its short-term memory is discarded and its
     * long-term handle closed; long-term records are kept.
     */
    public Result<Void> terminate(String sessionId) {
        Instant now = clock.instant();
        Optional<Result<Termination>> started = registry.update(sessionId, entry -> {
            Result<SessionStatus> moved = entry.state().transitionTo(SessionStatus.TERMINATING, now);
            if (!moved.isSuccess()) {
                return moved.<Termination>propagate();
            }
            return Result.ok(new Termination(moved.getValue(), entry.unit(), entry.longTermStore(),
                    entry.state().snapshot()));
        });
        if (started.isEmpty()) {
            return sessionNotFound(sessionId);
        }
        if (!started.get().isSuccess()) {
            log.warn("[Lifecycle] Rejected termination of {}: {}", sessionId, started.get().getMessage());
            return started.get().propagate();
        }
        Termination termination = started.get().getValue();
        emitStatus(sessionId, termination.previous(), SessionStatus.TERMINATING, now);

        if (termination.state().getConfig() != null && termination.state().getConfig().isPersistenceEnabled()) {
            persistenceService.save(termination.state());
        }
        resourceFactory.release(sessionId, new SessionResources(termination.unit(), termination.longTermStore()));

        Instant finished = clock.instant();
        boolean terminated = registry.update(sessionId,
                entry -> entry.state().transitionTo(SessionStatus.TERMINATED, finished).isSuccess())
                .orElse(false);
        if (terminated) {
            emitStatus(sessionId, SessionStatus.TERMINATING, SessionStatus.TERMINATED, finished);
            eventPublisher.emit(SessionEventType.SESSION_TERMINATED, sessionId, Map.of());
        }
        promotionService.forget(sessionId);
        scheduleReap(sessionId);
        log.info("[Lifecycle] Terminated session {}", sessionId);
        return Result.ok(null);
    }

    public Result<SessionState> getInfo(String sessionId) {
        return registry.snapshot(sessionId)
                .map(Result::ok)
                .orElseGet(() -> sessionNotFound(sessionId));
    }

    /**
     * All registered sessions, including terminated ones not yet reaped.
     */
    public List<SessionState> list() {
        return registry.snapshots();
    }

    public Result<SessionState> markIdle(String sessionId) {
        return transition(sessionId, SessionStatus.IDLE);
    }

    public Result<SessionState> markActive(String sessionId) {
        return transition(sessionId, SessionStatus.ACTIVE);
    }

    /**
     * Merges metadata and LLM config into a live session.
     */
    public Result<SessionState> update(String sessionId, SessionUpdate update) {
        Instant now = clock.instant();
        return registry.update(sessionId, entry -> {
            SessionState state = entry.state();
            if (!state.getStatus().isLive()) {
                return this.<SessionState>unavailable(sessionId, state.getStatus());
            }
            if (update != null) {
                if (update.getMetadata() != null) {
                    state.getMetadata().putAll(update.getMetadata());
                }
                if (update.getLlmConfig() != null) {
                    state.getLlmConfig().putAll(update.getLlmConfig());
                }
                if (update.getActiveTasks() != null) {
                    state.setActiveTasks(new ArrayList<>(update.getActiveTasks()));
                }
            }
            state.touch(now);
            return Result.ok(state.snapshot());
        }).orElseGet(() -> sessionNotFound(sessionId));
    }

    /**
     * Ends the session's unit abnormally. The session is then marked
     * TERMINATED with {@code reason} as its error.
     */
    public Result<Void> kill(String sessionId, String reason) {
        Optional<SessionEntry> entry = registry.lookup(sessionId);
        if (entry.isEmpty()) {
            return sessionNotFound(sessionId);
        }
        Optional<SessionUnit> unit = entry.map(SessionEntry::unit);
        if (unit.isEmpty() || !unit.get().isAlive()) {
            return Result.error(ErrorCode.SESSION_UNAVAILABLE, "Session " + sessionId + " is not running",
                    Map.of("session_id", sessionId));
        }
        log.warn("[Lifecycle] Killing session {}: {}", sessionId, reason);
        unit.get().kill(reason != null ? reason : "killed");
        return Result.ok(null);
    }

    /**
     * Moves ACTIVE sessions untouched for longer than their
     * {@code timeoutMinutes} to IDLE.
     *
     * @return number of sessions moved
     */
    public int sweepIdle() {
        Instant now = clock.instant();
        int moved = 0;
        for (SessionState state : registry.snapshots()) {
            if (state.getStatus() != SessionStatus.ACTIVE || state.getUpdatedAt() == null) {
                continue;
            }
            Duration timeout = Duration.ofMinutes(state.getConfig().getTimeoutMinutes());
            if (state.getUpdatedAt().plus(timeout).isBefore(now) && markIdle(state.getSessionId()).isSuccess()) {
                moved++;
            }
        }
        if (moved > 0) {
            log.info("[Lifecycle] Marked {} session(s) idle", moved);
        }
        return moved;
    }

    // ==================== conversation ====================

    /**
     * Appends a message to the session's conversation buffer. An IDLE session
     * becomes ACTIVE again.
     */
    public Result<Message> sendMessage(String sessionId, MessageRole role, String content) {
        if (role == null) {
            return Result.error(ErrorCode.MISSING_FIELDS, "Message role is required",
                    Map.of("fields", List.of("role")));
        }
        Instant now = clock.instant();
        Result<Reservation> reserved = registry.update(sessionId, entry -> {
            SessionState state = entry.state();
            if (!state.getStatus().isLive() || entry.unit() == null) {
                return this.<Reservation>unavailable(sessionId, state.getStatus());
            }
            int max = state.getConfig().getMaxConversations();
            if (state.getConversationCount() >= max) {
                return Result.<Reservation>error(ErrorCode.CONVERSATION_LIMIT,
                        "Session " + sessionId + " reached " + max + " conversations",
                        Map.of("session_id", sessionId, "max_conversations", max));
            }
            SessionStatus previous = state.getStatus();
            if (previous == SessionStatus.IDLE) {
                state.transitionTo(SessionStatus.ACTIVE, now);
            }
            int count = state.getConversationCount();
            state.incrementConversationCount(now);
            return Result.ok(new Reservation(entry.unit(), previous, count));
        }).orElseGet(() -> sessionNotFound(sessionId));
        if (!reserved.isSuccess()) {
            return reserved.propagate();
        }
        if (reserved.getValue().previous() == SessionStatus.IDLE) {
            emitStatus(sessionId, SessionStatus.IDLE, SessionStatus.ACTIVE, now);
        }

        ConversationBuffer.AddResult added;
        try {
            added = reserved.getValue().unit().withShortTermMemory(stm -> stm.addMessage(role, content));
        } catch (SessionException e) {
            release(sessionId, reserved.getValue());
            return e.toResult();
        }
        Message message = added.message();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("role", role.value());
        payload.put("content", content);
        payload.put("timestamp", message.getTimestamp());
        eventPublisher.emit(SessionEventType.CONVERSATION_ADDED, sessionId, payload);
        return Result.ok(message);
    }

    /**
     * Gives back a conversation slot whose message never reached the buffer.
     * The IDLE to ACTIVE move is undone only when no other send has
     * reserved a slot since.
     */
    private void release(String sessionId, Reservation reservation) {
        Instant now = clock.instant();
        Optional<StatusChange> reverted = registry.update(sessionId, entry -> {
            SessionState state = entry.state();
            state.decrementConversationCount(now);
            if (reservation.previous() == SessionStatus.IDLE
                    && state.getStatus() == SessionStatus.ACTIVE
                    && state.getConversationCount() == reservation.count()
                    && state.transitionTo(SessionStatus.IDLE, now).isSuccess()) {
                return new StatusChange(SessionStatus.ACTIVE, SessionStatus.IDLE);
            }
            return null;
        });
        reverted.ifPresent(change -> emitStatus(sessionId, change.from(), change.to(), now));
        log.debug("[Lifecycle] Released conversation slot of {}", sessionId);
    }

    public Result<List<Message>> recentMessages(String sessionId, int limit) {
        return onShortTermMemory(sessionId, stm -> stm.recentMessages(limit));
    }

    public Result<Void> clearConversation(String sessionId) {
        Result<Void> cleared = onShortTermMemory(sessionId, stm -> {
            stm.clearConversation();
            return null;
        });
        if (cleared.isSuccess()) {
            eventPublisher.emit(SessionEventType.CONVERSATION_CLEARED, sessionId, Map.of());
        }
        return cleared;
    }

    // ==================== working context ====================

    public Result<Optional<String>> putContext(String sessionId, String key, Object value) {
        if (key == null || key.isBlank()) {
            return Result.error(ErrorCode.EMPTY_FIELD, "Context key is required", Map.of("field", "key"));
        }
        return onShortTermMemory(sessionId, stm -> stm.putContext(key, value));
    }

    public Result<Object> getContext(String sessionId, String key) {
        return onShortTermMemory(sessionId, stm -> stm.getContext(key, null));
    }

    public Result<Boolean> deleteContext(String sessionId, String key) {
        return onShortTermMemory(sessionId, stm -> stm.deleteContext(key));
    }

    public Result<Map<String, Object>> listContext(String sessionId) {
        return onShortTermMemory(sessionId, ShortTermMemory::listContext);
    }

    // ==================== memory ====================

    public Result<PendingMemoryItem> enqueueMemory(String sessionId, PendingMemoryItem item) {
        Result<Result<PendingMemoryItem>> outcome = onShortTermMemory(sessionId, stm -> stm.enqueueMemory(item));
        if (!outcome.isSuccess()) {
            return outcome.propagate();
        }
        if (!outcome.getValue().isSuccess()) {
            log.warn("[Lifecycle] {} rejected pending memory: {}", sessionId, outcome.getValue().getMessage());
        }
        return outcome.getValue();
    }

    public Result<List<PendingMemoryItem>> pendingMemories(String sessionId) {
        return onShortTermMemory(sessionId, stm -> stm.pendingQueue().toList());
    }

    public Result<Map<String, Object>> shortTermSummary(String sessionId) {
        return onShortTermMemory(sessionId, ShortTermMemory::summary);
    }

    public Result<PromotionResult> promote(String sessionId, PromotionOptions options) {
        Result<SessionEntry> entry = liveEntry(sessionId);
        if (!entry.isSuccess()) {
            return entry.propagate();
        }
        return guarded(() -> promotionService.promote(entry.getValue().unit(), entry.getValue().longTermStore(),
                options));
    }

    public Result<PromotionResult> promoteAll(String sessionId) {
        Result<SessionEntry> entry = liveEntry(sessionId);
        if (!entry.isSuccess()) {
            return entry.propagate();
        }
        return guarded(() -> promotionService.promoteAll(entry.getValue().unit(), entry.getValue().longTermStore()));
    }

    /**
     * Runs a promotion cycle for every live session. Failures are logged per
     * session.
     *
     * @return number of memories promoted
     */
    public int promotePending() {
        int promoted = 0;
        for (SessionState state : registry.snapshots()) {
            if (!state.getStatus().isLive()) {
                continue;
            }
            Result<PromotionResult> result = promote(state.getSessionId(), null);
            if (result.isSuccess()) {
                promoted += result.getValue().getPromoted().size();
            } else if (result.getErrorCode() != ErrorCode.PROMOTION_IN_PROGRESS) {
                log.warn("[Lifecycle] Promotion for {} failed: {}", state.getSessionId(), result.getMessage());
            }
        }
        return promoted;
    }

    public Result<List<ScoredMemory>> search(String sessionId, RetrievalQuery query) {
        Result<LongTermStore> store = memory(sessionId);
        if (!store.isSuccess()) {
            return store.propagate();
        }
        return retrievalService.searchWithCache(store.getValue(), query);
    }

    public Result<EnrichedContext> enrichContext(String sessionId, RetrievalQuery query, EnrichOptions options) {
        Result<LongTermStore> store = memory(sessionId);
        if (!store.isSuccess()) {
            return store.propagate();
        }
        return retrievalService.enrichContext(store.getValue(), query, options);
    }

    /**
     * Long-term memory handle of a live session.
     */
    public Result<LongTermStore> memory(String sessionId) {
        return liveEntry(sessionId).map(SessionEntry::longTermStore);
    }

    // ==================== persistence ====================

    public Result<SavedSession> save(String sessionId) {
        Result<SessionState> state = getInfo(sessionId);
        if (!state.isSuccess()) {
            return state.propagate();
        }
        return persistenceService.save(state.getValue());
    }

    /**
     * Creates a new session carrying the saved configuration and metadata.
     *
     * @return the new session id
     */
    public Result<String> restore(String savedSessionId) {
        Result<SavedSession> saved = persistenceService.load(savedSessionId);
        if (!saved.isSuccess()) {
            return saved.propagate();
        }
        SessionState state = saved.getValue().getState();
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (state != null && state.getMetadata() != null) {
            metadata.putAll(state.getMetadata());
        }
        metadata.put("restored_from", savedSessionId);
        CreateSessionOptions options = CreateSessionOptions.builder()
                .config(state != null && state.getConfig() != null ? state.getConfig().copy() : null)
                .llmConfig(state != null && state.getLlmConfig() != null
                        ? new LinkedHashMap<>(state.getLlmConfig())
                        : new LinkedHashMap<>())
                .metadata(metadata)
                .build();
        Result<String> created = create(options);
        if (created.isSuccess()) {
            log.info("[Lifecycle] Restored {} as {}", savedSessionId, created.getValue());
        }
        return created;
    }

    public Result<List<SavedSession>> listSaved() {
        return persistenceService.listSaved();
    }

    public Result<Void> deleteSaved(String savedSessionId) {
        return persistenceService.deleteSaved(savedSessionId);
    }

    @PreDestroy
    public void shutdown() {
        for (SessionState state : registry.snapshots()) {
            registry.lookup(state.getSessionId())
                    .map(SessionEntry::unit)
                    .ifPresent(SessionUnit::stop);
        }
    }

    // ==================== internals ====================

    private void monitor(String sessionId, SessionUnit unit) {
        unit.exitFuture().whenComplete((ignored, error) -> {
            if (error != null) {
                handleCrash(sessionId, unit, unwrap(error));
            }
        });
    }

    private void handleCrash(String sessionId, SessionUnit unit, Throwable cause) {
        try {
            Instant now = clock.instant();
            String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            List<StatusChange> changes = registry.update(sessionId, entry -> {
                if (entry.unit() != unit) {
                    return List.<StatusChange>of();
                }
                SessionState state = entry.state();
                List<StatusChange> steps = new ArrayList<>();
                if (state.getStatus().isLive()) {
                    SessionStatus previous = state.transitionTo(SessionStatus.TERMINATING, now).getValue();
                    steps.add(new StatusChange(previous, SessionStatus.TERMINATING));
                }
                if (state.getStatus() == SessionStatus.TERMINATING
                        && state.transitionTo(SessionStatus.TERMINATED, now).isSuccess()) {
                    steps.add(new StatusChange(SessionStatus.TERMINATING, SessionStatus.TERMINATED));
                }
                if (!steps.isEmpty()) {
                    state.setError(reason);
                }
                return steps;
            }).orElse(List.of());
            if (changes.isEmpty()) {
                return;
            }

            log.error("[Lifecycle] Session {} crashed: {}", sessionId, reason);
            resourceFactory.release(sessionId, null);
            for (StatusChange change : changes) {
                emitStatus(sessionId, change.from(), change.to(), now);
            }
            eventPublisher.emit(SessionEventType.SESSION_TERMINATED, sessionId, Map.of("error", reason));
            promotionService.forget(sessionId);
            scheduleReap(sessionId);
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Lifecycle] Failed to handle crash of {}", sessionId, e);
        }
    }

    private Result<String> failAllocation(String sessionId, Throwable cause) {
        Throwable root = unwrap(cause);
        String reason = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        resourceFactory.release(sessionId, null);
        Instant now = clock.instant();
        registry.update(sessionId, entry -> {
            entry.state().transitionTo(SessionStatus.TERMINATED, now);
            entry.state().setError(reason);
            return null;
        });
        emitStatus(sessionId, SessionStatus.INITIALIZING, SessionStatus.TERMINATED, now);
        scheduleReap(sessionId);
        log.error("[Lifecycle] Allocation of {} failed: {}", sessionId, reason);
        if (root instanceof SessionException se) {
            return se.toResult();
        }
        return Result.error(ErrorCode.SESSION_UNAVAILABLE, "Session allocation failed: " + reason,
                Map.of("session_id", sessionId));
    }

    private void rollback(String sessionId, CompletableFuture<SessionResources> allocation) {
        allocation.whenComplete((late, error) -> resourceFactory.release(sessionId, late));
        registry.remove(sessionId);
    }

    private void scheduleReap(String sessionId) {
        long delay = properties.getLifecycle().getReapDelayMs();
        try {
            sessionScheduler.schedule(() -> reap(sessionId), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            reap(sessionId);
        }
    }

    private void reap(String sessionId) {
        if (registry.removeIf(sessionId, entry -> entry.state().getStatus() == SessionStatus.TERMINATED)) {
            eventPublisher.closeSession(sessionId);
            log.debug("[Lifecycle] Reaped session {}", sessionId);
        }
    }

    private Result<SessionState> transition(String sessionId, SessionStatus target) {
        Instant now = clock.instant();
        Result<StatusChange> moved = registry.update(sessionId, entry -> entry.state()
                .transitionTo(target, now)
                .map(previous -> new StatusChange(previous, target)))
                .orElseGet(() -> sessionNotFound(sessionId));
        if (!moved.isSuccess()) {
            return moved.propagate();
        }
        emitStatus(sessionId, moved.getValue().from(), target, now);
        return getInfo(sessionId);
    }

    private <T> Result<T> onShortTermMemory(String sessionId, Function<ShortTermMemory, T> action) {
        Result<SessionEntry> entry = liveEntry(sessionId);
        if (!entry.isSuccess()) {
            return entry.propagate();
        }
        return guarded(() -> Result.ok(entry.getValue().unit().withShortTermMemory(action)));
    }

    private <T> Result<T> guarded(Supplier<Result<T>> call) {
        try {
            return call.get();
        } catch (SessionException e) {
            return e.toResult();
        }
    }

    private Result<SessionEntry> liveEntry(String sessionId) {
        Optional<SessionEntry> entry = registry.lookup(sessionId);
        if (entry.isEmpty()) {
            return sessionNotFound(sessionId);
        }
        SessionStatus status = registry.snapshot(sessionId)
                .map(SessionState::getStatus)
                .orElse(SessionStatus.TERMINATED);
        if (!status.isLive() || entry.get().unit() == null) {
            return unavailable(sessionId, status);
        }
        return Result.ok(entry.get());
    }

    private void emitStatus(String sessionId, SessionStatus previous, SessionStatus current, Instant at) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", current.value());
        payload.put("previous_status", previous != null ? previous.value() : null);
        payload.put("updated_at", at);
        eventPublisher.emit(SessionEventType.SESSION_STATUS, sessionId, payload);
    }

    private <T> Result<T> unavailable(String sessionId, SessionStatus status) {
        return Result.error(ErrorCode.SESSION_UNAVAILABLE,
                "Session " + sessionId + " is " + (status != null ? status.value() : "unknown"),
                Map.of("session_id", sessionId, "status", status != null ? status.value() : "unknown"));
    }

    private static <T> Result<T> sessionNotFound(String sessionId) {
        return Result.error(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId,
                Map.of("session_id", sessionId != null ? sessionId : ""));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record Termination(SessionStatus previous, SessionUnit unit, LongTermStore longTermStore,
            SessionState state) {
    }

    private record Reservation(SessionUnit unit, SessionStatus previous, int count) {
    }

    private record StatusChange(SessionStatus from, SessionStatus to) {
    }
}
