package com.chicu.candlecollector.engine;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobRegistryTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private final JobRegistry registry = new JobRegistry();

    @Test
    void newRegistry_shouldHaveAllJobsIdle() {
        assertEquals(2, registry.snapshot().size());
        assertTrue(registry.snapshot().stream().allMatch(s -> s.state() == JobState.IDLE));
        assertEquals("current", registry.snapshot().get(0).name());
    }

    @Test
    void tryAcquire_shouldRejectSecondAcquire_untilRelease() {
        assertTrue(registry.tryAcquire(CollectionJob.CURRENT, T));
        assertFalse(registry.tryAcquire(CollectionJob.CURRENT, T.plusSeconds(1)));
        assertEquals(T, registry.status(CollectionJob.CURRENT).startedAt());

        registry.release(CollectionJob.CURRENT, T.plusSeconds(5), T.plusSeconds(20), null, "ok");

        JobStatus s = registry.status(CollectionJob.CURRENT);
        assertEquals(JobState.IDLE, s.state());
        assertNull(s.startedAt());
        assertEquals(T.plusSeconds(5), s.lastRunAt());
        assertEquals(T.plusSeconds(20), s.nextRunAt());
        assertEquals("ok", s.lastSummary());
        assertTrue(registry.tryAcquire(CollectionJob.CURRENT, T.plusSeconds(21)));
    }

    @Test
    void jobs_shouldBeIndependent() {
        assertTrue(registry.tryAcquire(CollectionJob.CURRENT, T));
        assertTrue(registry.tryAcquire(CollectionJob.HISTORICAL, T));
        assertTrue(registry.isRunning(CollectionJob.HISTORICAL));
    }

    @Test
    void release_shouldKeepLastError() {
        registry.tryAcquire(CollectionJob.HISTORICAL, T);
        registry.release(CollectionJob.HISTORICAL, T.plusSeconds(1), null, "IllegalStateException: boom", null);

        assertEquals("IllegalStateException: boom", registry.status(CollectionJob.HISTORICAL).lastError());
    }

    @Test
    void concurrentAcquire_shouldLetExactlyOneWin() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();

        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (registry.tryAcquire(CollectionJob.CURRENT, T)) {
                        winners.incrementAndGet();
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, winners.get());
    }
}
