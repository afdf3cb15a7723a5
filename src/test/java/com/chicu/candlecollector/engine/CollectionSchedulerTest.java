package com.chicu.candlecollector.engine;

import com.chicu.candlecollector.collector.CandleCollectionOrchestrator;
import com.chicu.candlecollector.collector.CollectionMode;
import com.chicu.candlecollector.collector.CollectionRunResult;
import com.chicu.candlecollector.config.CollectorProperties;
import com.chicu.candlecollector.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CollectionSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T01:00:00Z");

    @Mock
    private CandleCollectionOrchestrator orchestrator;

    @Mock
    private ScheduledExecutorService ticker;

    @Mock
    private ExecutorService jobRunner;

    @Mock
    private ScheduledFuture<Object> tickFuture;

    private JobRegistry registry;
    private CollectorProperties props;
    private MutableClock clock;
    private CollectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = new JobRegistry();
        props = new CollectorProperties();
        clock = new MutableClock(NOW);
        scheduler = new CollectionScheduler(registry, orchestrator, ticker, jobRunner, props, clock);
    }

    private void startTicker() {
        doReturn(tickFuture).when(ticker)
                .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        scheduler.start();
    }

    private Runnable capturedJob() {
        ArgumentCaptor<Runnable> cap = ArgumentCaptor.forClass(Runnable.class);
        verify(jobRunner, atLeastOnce()).execute(cap.capture());
        List<Runnable> all = cap.getAllValues();
        return all.get(all.size() - 1);
    }

    private static CollectionRunResult emptyRun(CollectionMode mode) {
        return new CollectionRunResult(mode, NOW, NOW, List.of());
    }

    // ===== РУЧНОЙ ЗАПУСК =====

    @Test
    void trigger_shouldBeRejected_whileSameJobRuns() {
        assertEquals(TriggerResult.ACCEPTED, scheduler.trigger(CollectionJob.CURRENT));
        assertEquals(TriggerResult.REJECTED_ALREADY_RUNNING, scheduler.trigger(CollectionJob.CURRENT));
        assertEquals(TriggerResult.ACCEPTED, scheduler.trigger(CollectionJob.HISTORICAL), "job'ы независимы");

        verify(jobRunner, times(2)).execute(any(Runnable.class));
    }

    @Test
    void finishedJob_shouldReturnToIdle_withSummary() {
        when(orchestrator.collectCurrent()).thenReturn(emptyRun(CollectionMode.CURRENT));

        scheduler.trigger(CollectionJob.CURRENT);
        assertTrue(registry.isRunning(CollectionJob.CURRENT));

        clock.advance(Duration.ofSeconds(3));
        capturedJob().run();

        JobStatus s = registry.status(CollectionJob.CURRENT);
        assertEquals(JobState.IDLE, s.state());
        assertEquals(NOW.plusSeconds(3), s.lastRunAt());
        assertNull(s.lastError());
        assertTrue(s.lastSummary().startsWith("CURRENT"));
        assertEquals(TriggerResult.ACCEPTED, scheduler.trigger(CollectionJob.CURRENT));
    }

    @Test
    void failingJob_shouldRecordError_andRelease() {
        when(orchestrator.collectHistorical()).thenThrow(new IllegalStateException("db down"));

        scheduler.trigger(CollectionJob.HISTORICAL);
        capturedJob().run();

        JobStatus s = registry.status(CollectionJob.HISTORICAL);
        assertEquals(JobState.IDLE, s.state());
        assertEquals("IllegalStateException: db down", s.lastError());
    }

    @Test
    void rejectedByPool_shouldReleaseImmediately() {
        doThrow(new RejectedExecutionException("pool shut down")).when(jobRunner).execute(any(Runnable.class));

        scheduler.trigger(CollectionJob.CURRENT);

        JobStatus s = registry.status(CollectionJob.CURRENT);
        assertEquals(JobState.IDLE, s.state());
        assertTrue(s.lastError().contains("pool shut down"));
    }

    // ===== ТАЙМЕР =====

    @Test
    void start_shouldPlanFirstRuns() {
        startTicker();

        assertTrue(scheduler.isRunning());
        assertEquals(NOW.plus(props.getCurrent().getInterval()), registry.status(CollectionJob.CURRENT).nextRunAt());
        assertEquals(Instant.parse("2024-01-02T00:30:00Z"), registry.status(CollectionJob.HISTORICAL).nextRunAt());
    }

    @Test
    void tick_shouldFireDueJob_andPlanNextRun() {
        startTicker();

        clock.advance(Duration.ofSeconds(15));
        scheduler.tick();

        verify(jobRunner, times(1)).execute(any(Runnable.class));
        assertTrue(registry.isRunning(CollectionJob.CURRENT));
        assertFalse(registry.isRunning(CollectionJob.HISTORICAL));
        assertEquals(NOW.plusSeconds(30), registry.status(CollectionJob.CURRENT).nextRunAt());
    }

    @Test
    void tick_shouldDoNothing_beforeDueTime() {
        startTicker();

        clock.advance(Duration.ofSeconds(14));
        scheduler.tick();

        verifyNoInteractions(jobRunner);
    }

    @Test
    void tick_whileJobRuns_shouldSkipAndMoveNextRun() {
        startTicker();
        scheduler.trigger(CollectionJob.CURRENT);

        clock.advance(Duration.ofSeconds(16));
        scheduler.tick();

        verify(jobRunner, times(1)).execute(any(Runnable.class));
        assertEquals(NOW.plusSeconds(31), registry.status(CollectionJob.CURRENT).nextRunAt());
    }

    @Test
    void stop_shouldCancelTicker() {
        startTicker();

        scheduler.stop();

        verify(tickFuture).cancel(false);
        assertFalse(scheduler.isRunning());
    }

    @Test
    void disabledScheduler_shouldNotTick_butAllowManualRuns() {
        props.getScheduler().setEnabled(false);

        scheduler.start();

        verifyNoInteractions(ticker);
        assertFalse(scheduler.isRunning());
        assertNull(registry.status(CollectionJob.CURRENT).nextRunAt());
        assertEquals(TriggerResult.ACCEPTED, scheduler.trigger(CollectionJob.CURRENT));
    }

    @Test
    void nextAfter_historical_shouldFollowCronInZone() {
        assertEquals(Instant.parse("2024-01-01T00:30:00Z"),
                scheduler.nextAfter(CollectionJob.HISTORICAL, Instant.parse("2023-12-31T23:00:00Z")));
        assertEquals(Instant.parse("2024-01-02T00:30:00Z"),
                scheduler.nextAfter(CollectionJob.HISTORICAL, Instant.parse("2024-01-01T00:30:00Z")));
    }
}
