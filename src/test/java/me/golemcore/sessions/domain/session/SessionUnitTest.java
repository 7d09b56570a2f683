package me.golemcore.sessions.domain.session;

import me.golemcore.sessions.domain.memory.ShortTermMemory;
import me.golemcore.sessions.domain.model.ErrorCode;
import me.golemcore.sessions.domain.model.MemoryType;
import me.golemcore.sessions.domain.model.PendingMemoryItem;
import me.golemcore.sessions.domain.model.MessageRole;
import me.golemcore.sessions.domain.model.SessionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionUnitTest {

    private static final String SESSION_ID = "session_unit";

    private SessionUnit unit;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        unit = new SessionUnit(SESSION_ID, new ShortTermMemory(SESSION_ID, clock), 500);
    }

    @AfterEach
    void tearDown() {
        unit.stop();
    }

    @Test
    void shouldRunActionsOnDedicatedDaemonThread() throws Exception {
        Thread worker = unit.submit(stm -> Thread.currentThread()).get(1, TimeUnit.SECONDS);

        assertEquals("session-" + SESSION_ID, worker.getName());
        assertTrue(worker.isDaemon());
    }

    @Test
    void shouldApplyActionsInOrder() {
        unit.withShortTermMemory(stm -> stm.addMessage(MessageRole.USER, "one"));
        unit.withShortTermMemory(stm -> stm.addMessage(MessageRole.USER, "two"));

        assertEquals("two", unit.withShortTermMemory(stm -> stm.recentMessages(1).get(0).getContent()));
    }

    @Test
    void shouldRunNestedCallsInline() {
        int count = unit.withShortTermMemory(stm -> unit.withShortTermMemory(ShortTermMemory::messageCount));

        assertEquals(0, count);
    }

    @Test
    void shouldFailOnlyTheThrowingAction() {
        assertThrows(IllegalStateException.class, () -> unit.withShortTermMemory(stm -> {
            throw new IllegalStateException("bad action");
        }));

        assertTrue(unit.isAlive());
        assertEquals(0, unit.withShortTermMemory(ShortTermMemory::messageCount));
    }

    @Test
    void shouldCrashOnError() {
        CompletableFuture<Void> exit = unit.exitFuture();

        CompletableFuture<Object> failing = unit.submit(stm -> {
            throw new AssertionError("corrupted");
        });

        ExecutionException ex = assertThrows(ExecutionException.class, () -> exit.get(1, TimeUnit.SECONDS));
        assertInstanceOf(SessionCrashedException.class, ex.getCause());
        assertTrue(failing.isCompletedExceptionally());
        assertFalse(unit.isAlive());
    }

    @Test
    void shouldExitAbnormallyWhenKilled() {
        CompletableFuture<Void> exit = unit.exitFuture();

        unit.kill("operator request");

        assertTrue(exit.isCompletedExceptionally());
        SessionException ex = assertThrows(SessionException.class,
                () -> unit.withShortTermMemory(ShortTermMemory::messageCount));
        assertEquals(ErrorCode.SESSION_UNAVAILABLE, ex.getErrorCode());
    }

    @Test
    void shouldExitNormallyWhenStopped() throws Exception {
        CompletableFuture<Void> exit = unit.exitFuture();

        unit.stop();

        exit.get(1, TimeUnit.SECONDS);
        assertFalse(exit.isCompletedExceptionally());
        assertFalse(unit.isAlive());
    }

    @Test
    void shouldTimeOutSlowActions() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        try {
            unit.submit(stm -> {
                try {
                    return release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            });

            SessionException ex = assertThrows(SessionException.class,
                    () -> unit.withShortTermMemory(ShortTermMemory::messageCount));
            assertEquals(ErrorCode.TIMEOUT, ex.getErrorCode());
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldNotRunActionWithdrawnAfterTimeout() throws Exception {
        unit.withShortTermMemory(stm -> stm.enqueueMemory(PendingMemoryItem.builder()
                .id("m1")
                .type(MemoryType.FACT)
                .data("kept")
                .build()));
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Boolean> blocker = unit.submit(stm -> awaitQuietly(release));

        SessionException ex = assertThrows(SessionException.class,
                () -> unit.withShortTermMemory(ShortTermMemory::dequeueMemory));
        assertEquals(ErrorCode.TIMEOUT, ex.getErrorCode());

        release.countDown();
        blocker.get(1, TimeUnit.SECONDS);
        assertEquals(1, unit.withShortTermMemory(ShortTermMemory::pendingCount));
    }

    @Test
    void shouldWaitForActionAlreadyStarted() {
        int count = unit.withShortTermMemory(stm -> {
            sleepQuietly(800);
            stm.addMessage(MessageRole.USER, "slow but applied");
            return stm.messageCount();
        });

        assertEquals(1, count);
        assertEquals(1, unit.withShortTermMemory(ShortTermMemory::messageCount));
    }

    @Test
    void shouldFailQueuedActionsWhenStopped() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Boolean> blocker = unit.submit(stm -> awaitQuietly(release));
        CompletableFuture<Integer> queued = unit.submit(ShortTermMemory::messageCount);

        unit.stop();
        release.countDown();
        blocker.get(1, TimeUnit.SECONDS);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> queued.get(1, TimeUnit.SECONDS));
        SessionException cause = assertInstanceOf(SessionException.class, ex.getCause());
        assertEquals(ErrorCode.SESSION_UNAVAILABLE, cause.getErrorCode());
    }

    @Test
    void shouldNotLetObserversCompleteExit() {
        unit.exitFuture().complete(null);

        assertTrue(unit.isAlive());
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
