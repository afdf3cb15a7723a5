package com.chicu.candlecollector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;

@Data
@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {

    /**
     * Сколько единиц (биржа × пара × таймфрейм) выполняется одновременно.
     */
    private int workers = 8;

    /**
     * Одновременных единиц на одну биржу.
     */
    private int perExchangeConcurrency = 2;

    /**
     * Каталог лог-файлов (для /api/collection/logs).
     */
    private String logDir = "logs";

    private Current current = new Current();
    private Historical historical = new Historical();
    private Retry retry = new Retry();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Current {

        /** период job "current" */
        private Duration interval = Duration.ofSeconds(15);

        /** сколько последних свечей брать за раз */
        private int candlesPerFetch = 2;

        /** мягкий бюджет одного прогона */
        private Duration runBudget = Duration.ofMinutes(2);
    }

    @Data
    public static class Historical {

        /** cron job "historical" (секунды, минуты, часы, ...) */
        private String cron = "0 30 0 * * *";

        private String zone = "UTC";

        /** с какого момента строится история */
        private Instant start = Instant.parse("2020-01-01T00:00:00Z");

        /** размер страницы (обрезается до максимума биржи) */
        private int pageSize = 1000;

        private Duration runBudget = Duration.ofHours(6);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 4;
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
    }

    @Data
    public static class Scheduler {

        /** false: таймеры не запускаются, ручной запуск работает */
        private boolean enabled = true;

        /** шаг цикла планировщика */
        private Duration tick = Duration.ofSeconds(1);
    }
}
