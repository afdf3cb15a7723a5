package com.chicu.candlecollector.engine;

import com.chicu.candlecollector.collector.CandleCollectionOrchestrator;
import com.chicu.candlecollector.collector.CollectionRunResult;
import com.chicu.candlecollector.config.CollectorProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Планировщик двух job'ов сбора.
 *
 * - current: каждые collector.current.interval
 * - historical: по cron collector.historical.cron
 *
 * Один поток-тикер проверяет, не пора ли. Job выполняется на отдельном пуле,
 * любой запуск (таймер или ручной) идёт через JobRegistry: acquire → run → release.
 */
@Slf4j
@Service
public class CollectionScheduler {

    private final JobRegistry registry;
    private final CandleCollectionOrchestrator orchestrator;
    private final ScheduledExecutorService ticker;
    private final ExecutorService jobRunner;
    private final CollectorProperties props;
    private final Clock clock;

    private final CronExpression historicalCron;
    private final ZoneId historicalZone;

    private volatile ScheduledFuture<?> tickTask;

    public CollectionScheduler(JobRegistry registry,
                               CandleCollectionOrchestrator orchestrator,
                               @Qualifier("collectorTicker") ScheduledExecutorService ticker,
                               @Qualifier("collectorJobRunner") ExecutorService jobRunner,
                               CollectorProperties props,
                               Clock clock) {
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.ticker = ticker;
        this.jobRunner = jobRunner;
        this.props = props;
        this.clock = clock;
        this.historicalCron = CronExpression.parse(props.getHistorical().getCron());
        this.historicalZone = ZoneId.of(props.getHistorical().getZone());
    }

    // ==============================================================
    // ▶️ START / 🛑 STOP
    // ==============================================================

    @PostConstruct
    public void start() {
        if (!props.getScheduler().isEnabled()) {
            log.info("⏸ Планировщик выключен (collector.scheduler.enabled=false), доступен только ручной запуск");
            return;
        }

        Instant now = clock.instant();
        for (CollectionJob job : CollectionJob.values()) {
            registry.setNextRun(job, nextAfter(job, now));
        }

        long tickMs = Math.max(100, props.getScheduler().getTick().toMillis());
        tickTask = ticker.scheduleWithFixedDelay(this::tick, tickMs, tickMs, TimeUnit.MILLISECONDS);

        log.info("⏱ Планировщик запущен: current каждые {}, historical по cron '{}' ({})",
                props.getCurrent().getInterval(), props.getHistorical().getCron(), historicalZone);
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> task = tickTask;
        if (task != null) {
            task.cancel(false);
            tickTask = null;
            log.info("💤 Планировщик остановлен");
        }
    }

    public boolean isRunning() {
        ScheduledFuture<?> task = tickTask;
        return task != null && !task.isCancelled() && !task.isDone();
    }

    // ==============================================================
    // ⏱ TICK
    // ==============================================================

    /**
     * Один шаг цикла: запускает job'ы, у которых наступил next_run_at.
     * Job, который ещё выполняется, пропускается до следующего срока.
     */
    void tick() {
        try {
            Instant now = clock.instant();

            for (CollectionJob job : CollectionJob.values()) {
                Instant due = registry.status(job).nextRunAt();
                if (due == null || now.isBefore(due)) {
                    continue;
                }

                registry.setNextRun(job, nextAfter(job, now));

                if (fire(job, now) == TriggerResult.REJECTED_ALREADY_RUNNING) {
                    log.info("⏭ Job '{}' ещё выполняется, тик пропущен", job.getJobName());
                }
            }
        } catch (RuntimeException e) {
            // тикер не должен умереть из-за одного сбоя
            log.error("❌ Ошибка цикла планировщика: {}", e.getMessage(), e);
        }
    }

    // ==============================================================
    // 🖐 РУЧНОЙ ЗАПУСК
    // ==============================================================

    public TriggerResult trigger(CollectionJob job) {
        TriggerResult result = fire(job, clock.instant());
        if (result == TriggerResult.ACCEPTED) {
            log.info("🖐 Job '{}' запущен вручную", job.getJobName());
        } else {
            log.info("⛔ Job '{}' уже выполняется, ручной запуск отклонён", job.getJobName());
        }
        return result;
    }

    // ==============================================================
    // ВНУТРЕННЕЕ
    // ==============================================================

    private TriggerResult fire(CollectionJob job, Instant now) {
        if (!registry.tryAcquire(job, now)) {
            return TriggerResult.REJECTED_ALREADY_RUNNING;
        }

        try {
            jobRunner.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            log.error("❌ Job '{}' не удалось запустить: {}", job.getJobName(), e.getMessage());
            Instant fin = clock.instant();
            registry.release(job, fin, nextRunAt(job, fin), "not started: " + e.getMessage(), null);
        }
        return TriggerResult.ACCEPTED;
    }

    private void runJob(CollectionJob job) {
        String error = null;
        String summary = null;

        log.info("▶️ Job '{}' стартовал", job.getJobName());
        try {
            CollectionRunResult result = job == CollectionJob.CURRENT
                    ? orchestrator.collectCurrent()
                    : orchestrator.collectHistorical();
            summary = result.summary();

        } catch (RuntimeException e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("❌ Job '{}' упал: {}", job.getJobName(), error, e);

        } finally {
            Instant fin = clock.instant();
            registry.release(job, fin, nextRunAt(job, fin), error, summary);
            log.info("⏹ Job '{}' завершён", job.getJobName());
        }
    }

    /** Уже запланированный срок, если он впереди; иначе следующий после finishedAt */
    private Instant nextRunAt(CollectionJob job, Instant finishedAt) {
        if (!props.getScheduler().isEnabled()) {
            return null;
        }
        Instant planned = registry.status(job).nextRunAt();
        if (planned != null && planned.isAfter(finishedAt)) {
            return planned;
        }
        return nextAfter(job, finishedAt);
    }

    Instant nextAfter(CollectionJob job, Instant from) {
        if (job == CollectionJob.CURRENT) {
            return from.plus(props.getCurrent().getInterval());
        }
        ZonedDateTime next = historicalCron.next(from.atZone(historicalZone));
        return next == null ? null : next.toInstant();
    }
}
