package com.chicu.candlecollector.config;

import com.chicu.candlecollector.common.time.Sleeper;
import com.chicu.candlecollector.exchange.client.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

@Configuration
public class CollectorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public RetryPolicy retryPolicy(CollectorProperties props) {
        CollectorProperties.Retry r = props.getRetry();
        return RetryPolicy.builder()
                .maxAttempts(r.getMaxAttempts())
                .initialDelay(r.getInitialDelay())
                .maxDelay(r.getMaxDelay())
                .multiplier(r.getMultiplier())
                .build();
    }

    /** Пул единиц сбора: ограничивает одновременные запросы к биржам */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collectorWorkers(CollectorProperties props) {
        return Executors.newFixedThreadPool(Math.max(1, props.getWorkers()), named("collector-worker-"));
    }

    /** Исполнитель самих job'ов: один поток на job */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collectorJobRunner() {
        return Executors.newFixedThreadPool(2, named("collector-job-"));
    }

    /** Цикл планировщика */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService collectorTicker() {
        return Executors.newSingleThreadScheduledExecutor(named("collector-tick-"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicLong ctr = new AtomicLong(1);
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
