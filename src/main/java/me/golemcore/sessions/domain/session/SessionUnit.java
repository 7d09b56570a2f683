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
import me.golemcore.sessions.domain.memory.ShortTermMemory;
import me.golemcore.sessions.domain.memory.ShortTermMemoryAccess;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.SessionException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Isolated worker of one session.
 *
 * <p>
 * A unit owns the session's {@link ShortTermMemory} and a single worker thread
 * that acts as its mailbox: every action on the memory is queued and executed
 * in order on that thread. A runtime exception fails only the action that
 * threw it. An {@link Error}, or {@link #kill(String)}, ends the unit
 * abnormally: the exit future completes exceptionally with a
 * {@link SessionCrashedException}. {@link #stop()} ends it normally.
 *
 * <p>
 * Observers watch {@link #exitFuture()}; a unit never notifies or interrupts
 * anything outside itself.
 *
 * <p>
 * A blocking call that times out before the worker picks it up is withdrawn
 * and never runs. Once the worker has started it, the caller waits for its
 * outcome, so a caller is never told {@code timeout} for an action that took
 * effect.
 */
@Slf4j
public class SessionUnit implements ShortTermMemoryAccess {

    private final String sessionId;
    private final ShortTermMemory memory;
    private final ExecutorService worker;
    private final long callTimeoutMs;
    private final CompletableFuture<Void> exit = new CompletableFuture<>();

    private volatile Thread workerThread;

    public SessionUnit(String sessionId, ShortTermMemory memory, long callTimeoutMs) {
        this.sessionId = sessionId;
        this.memory = memory;
        this.callTimeoutMs = callTimeoutMs;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "session-" + sessionId);
            t.setDaemon(true);
            workerThread = t;
            return t;
        });
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Completes normally on {@link #stop()}, exceptionally on a crash or kill.
     * Observers must not complete it themselves.
     */
    public CompletableFuture<Void> exitFuture() {
        return exit.copy();
    }

    public boolean isAlive() {
        return !exit.isDone();
    }

    /**
     * Queues an action on the worker. Cancelling the returned future before the
     * worker reaches the action withdraws it.
     */
    public <T> CompletableFuture<T> submit(Function<ShortTermMemory, T> action) {
        return enqueue(action).result;
    }

    /**
     * Runs an action on the worker and waits for its result.
     *
     * @throws SessionException
     *             with {@code session_unavailable} when the unit is gone, or
     *             {@code timeout} when the worker does not pick the action up in
     *             time (the action is then withdrawn)
     */
    @Override
    public <T> T withShortTermMemory(Function<ShortTermMemory, T> action) {
        if (Thread.currentThread() == workerThread) {
            return action.apply(memory);
        }
        Call<T> call = enqueue(action);
        try {
            return call.result.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.withdraw();
            throw interrupted(e);
        } catch (TimeoutException e) {
            if (call.withdraw()) {
                throw new SessionException(ErrorCode.TIMEOUT, "Session " + sessionId + " did not respond in time",
                        e);
            }
            return awaitStarted(call);
        } catch (ExecutionException e) {
            throw failure(e);
        }
    }

    private <T> T awaitStarted(Call<T> call) {
        try {
            return call.result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw interrupted(e);
        } catch (ExecutionException e) {
            throw failure(e);
        }
    }

    private <T> Call<T> enqueue(Function<ShortTermMemory, T> action) {
        Call<T> call = new Call<>(action);
        if (exit.isDone()) {
            call.result.completeExceptionally(unavailable());
            return call;
        }
        try {
            worker.execute(() -> run(call));
        } catch (RejectedExecutionException e) {
            call.result.completeExceptionally(unavailable());
        }
        return call;
    }

    /**
     * Ends the unit normally. Actions still queued fail with
     * {@code session_unavailable}.
     */
    public void stop() {
        if (exit.complete(null)) {
            worker.shutdown();
            log.debug("[Unit] {} stopped", sessionId);
        }
    }

    /**
     * Ends the unit abnormally. Pending actions are abandoned.
     */
    public void kill(String reason) {
        crash(new SessionCrashedException(reason));
    }

    private <T> void run(Call<T> call) {
        if (!call.start()) {
            return;
        }
        if (exit.isDone()) {
            call.result.completeExceptionally(unavailable());
            return;
        }
        try {
            call.result.complete(call.action.apply(memory));
        } catch (RuntimeException e) {
            call.result.completeExceptionally(e);
        } catch (Error e) { // NOSONAR
            call.result.completeExceptionally(e);
            crash(new SessionCrashedException("Session worker failed: " + e, e));
        }
    }

    private void crash(SessionCrashedException cause) {
        if (exit.completeExceptionally(cause)) {
            log.warn("[Unit] {} exited abnormally: {}", sessionId, cause.getMessage());
            worker.shutdownNow();
        }
    }

    private SessionException unavailable() {
        return new SessionException(ErrorCode.SESSION_UNAVAILABLE, "Session " + sessionId + " is not running");
    }

    private SessionException interrupted(InterruptedException e) {
        return new SessionException(ErrorCode.SESSION_UNAVAILABLE, "Interrupted while waiting for " + sessionId, e);
    }

    private RuntimeException failure(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new SessionException(ErrorCode.SESSION_UNAVAILABLE,
                "Session " + sessionId + " failed: " + cause.getMessage(), cause);
    }

    /**
     * A queued action, claimed exactly once: by the worker to run it or by the
     * caller to withdraw it.
     */
    private static final class Call<T> {

        private final Function<ShortTermMemory, T> action;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final AtomicBoolean claimed = new AtomicBoolean();

        private Call(Function<ShortTermMemory, T> action) {
            this.action = action;
        }

        boolean start() {
            return !result.isDone() && claimed.compareAndSet(false, true);
        }

        boolean withdraw() {
            if (claimed.compareAndSet(false, true)) {
                result.cancel(false);
                return true;
            }
            return false;
        }
    }
}
