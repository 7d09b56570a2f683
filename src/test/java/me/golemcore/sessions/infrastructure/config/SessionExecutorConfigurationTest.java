package me.golemcore.sessions.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionExecutorConfigurationTest {

    @Test
    void shouldCreateDaemonAllocationThreadsWithPrefix() throws Exception {
        SessionExecutorConfiguration config = new SessionExecutorConfiguration();
        ExecutorService executor = config.sessionAllocationExecutor();
        assertNotNull(executor);

        AtomicReference<String> threadName = new AtomicReference<>();
        AtomicReference<Boolean> isDaemon = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        executor.submit(() -> {
            threadName.set(Thread.currentThread().getName());
            isDaemon.set(Thread.currentThread().isDaemon());
            latch.countDown();
        });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals("session-alloc-1", threadName.get());
        assertTrue(isDaemon.get());

        config.shutdown();
    }

    @Test
    void shouldRunScheduledTasksOnSchedulerThread() throws Exception {
        SessionExecutorConfiguration config = new SessionExecutorConfiguration();
        ScheduledExecutorService scheduler = config.sessionScheduler();

        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        scheduler.schedule(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        }, 10, TimeUnit.MILLISECONDS);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(threadName.get().startsWith("session-scheduler-"));

        config.shutdown();
    }

    @Test
    void shouldReuseExecutorsAndShutdownCleanly() {
        SessionExecutorConfiguration config = new SessionExecutorConfiguration();
        ExecutorService executor = config.sessionAllocationExecutor();
        ScheduledExecutorService scheduler = config.sessionScheduler();

        assertSame(executor, config.sessionAllocationExecutor());

        config.shutdown();

        assertTrue(executor.isShutdown());
        assertTrue(scheduler.isShutdown());
    }
}
