package com.chicu.candlecollector.common.time;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Таймфрейм свечи с фиксированной сеткой открытия.
 *
 * Сетка:
 * - минуты/часы/дни: кратно длительности от epoch (UTC);
 * - неделя: от понедельника 00:00 UTC (так режут Binance/Bybit/OKX);
 * - месяц: первое число месяца 00:00 UTC, длина переменная.
 *
 * Парсинг строк: через словарь, без switch по строкам.
 */
public enum Timeframe {

    // минуты
    M1(1,    "1m"),
    M3(3,    "3m"),
    M5(5,    "5m"),
    M15(15,  "15m"),
    M30(30,  "30m"),

    // часы
    H1(60,   "1h"),
    H2(120,  "2h"),
    H4(240,  "4h"),
    H6(360,  "6h"),
    H8(480,  "8h"),
    H12(720, "12h"),

    // дни/неделя/месяц
    D1(1440,   "1d"),
    W1(10080,  "1w"),
    MON1(43200, "1M"); // условный месяц 30 дней, сетка: календарная

    /** 1970-01-01: четверг, ближайший понедельник: 1970-01-05. */
    private static final long WEEK_ANCHOR_SECONDS = 4L * 86_400L;

    private final int minutes;
    private final String code;

    Timeframe(int minutes, String code) {
        this.minutes = minutes;
        this.code = code;
    }

    /** Кол-во минут в одном баре (для месяца: условные 30 дней). */
    public int getMinutes() {
        return minutes;
    }

    public long getStepSeconds() {
        return minutes * 60L;
    }

    public Duration getDuration() {
        return Duration.ofMinutes(minutes);
    }

    /** Каноническое имя ("1m", "1h", "1d", "1M"), совпадает с Binance. */
    public String getCode() {
        return code;
    }

    /** false только для месяца: его длина зависит от календаря. */
    public boolean isFixedLength() {
        return this != MON1;
    }

    // ---------- Сетка ----------

    /**
     * Лежит ли openTime ровно на сетке этого таймфрейма.
     */
    public boolean isAligned(Instant openTime) {
        if (openTime == null || openTime.getNano() != 0) {
            return false;
        }
        long sec = openTime.getEpochSecond();

        return switch (this) {
            case W1 -> Math.floorMod(sec - WEEK_ANCHOR_SECONDS, getStepSeconds()) == 0;
            case MON1 -> {
                ZonedDateTime z = openTime.atZone(ZoneOffset.UTC);
                yield z.getDayOfMonth() == 1 && z.toLocalTime().toSecondOfDay() == 0;
            }
            default -> Math.floorMod(sec, getStepSeconds()) == 0;
        };
    }

    /**
     * Начало бара, в который попадает t.
     */
    public Instant floor(Instant t) {
        long sec = t.getEpochSecond();

        return switch (this) {
            case W1 -> Instant.ofEpochSecond(
                    sec - Math.floorMod(sec - WEEK_ANCHOR_SECONDS, getStepSeconds()));
            case MON1 -> t.atZone(ZoneOffset.UTC)
                    .withDayOfMonth(1)
                    .truncatedTo(ChronoUnit.DAYS)
                    .toInstant();
            default -> Instant.ofEpochSecond(sec - Math.floorMod(sec, getStepSeconds()));
        };
    }

    /**
     * Первая точка сетки, не раньше t.
     */
    public Instant alignUp(Instant t) {
        Instant f = floor(t);
        return (f.equals(t) && t.getNano() == 0) ? f : next(f);
    }

    /** Открытие следующего бара. */
    public Instant next(Instant openTime) {
        if (this == MON1) {
            return openTime.atZone(ZoneOffset.UTC).plusMonths(1).toInstant();
        }
        return openTime.plusSeconds(getStepSeconds());
    }

    /** Открытие бара через bars шагов после openTime. */
    public Instant plusBars(Instant openTime, long bars) {
        if (!isFixedLength()) {
            return openTime.atZone(ZoneOffset.UTC).plusMonths(bars).toInstant();
        }
        return openTime.plusSeconds(getStepSeconds() * bars);
    }

    /** Время закрытия бара, открытого в openTime. */
    public Instant closeTime(Instant openTime) {
        return next(openTime);
    }

    // ---------- Разбор ----------

    private static final Map<String, Timeframe> LOOKUP;
    private static final Map<Integer, Timeframe> BY_MINUTES;

    static {
        Map<String, Timeframe> m = new HashMap<>();

        putAll(m, M1,  "1min", "1 minute", "1-minute");
        putAll(m, M3,  "3min", "3 minutes");
        putAll(m, M5,  "5min", "5 minutes");
        putAll(m, M15, "15min", "15 minutes");
        putAll(m, M30, "30min", "30 minutes");

        putAll(m, H1,  "1hr", "1 hour", "60m");
        putAll(m, H2,  "2hr", "2 hours");
        putAll(m, H4,  "4hr", "4 hours");
        putAll(m, H6,  "6hr", "6 hours");
        putAll(m, H8,  "8hr", "8 hours");
        putAll(m, H12, "12hr", "12 hours");

        putAll(m, D1,  "1day", "1 day", "24h");
        putAll(m, W1,  "1week", "1 week", "7d");

        LOOKUP = Collections.unmodifiableMap(m);

        Map<Integer, Timeframe> byMin = new HashMap<>();
        for (Timeframe tf : values()) {
            byMin.put(tf.minutes, tf);
        }
        BY_MINUTES = Collections.unmodifiableMap(byMin);
    }

    private static String norm(String s) {
        return s.trim().toLowerCase(Locale.ROOT).replace(" ", "");
    }

    private static void putAll(Map<String, Timeframe> m, Timeframe tf, String... keys) {
        for (String k : keys) {
            m.put(norm(k), tf);
        }
        m.put(norm(tf.code), tf);
    }

    /**
     * Таймфрейм по числу минут из TimePeriod.
     * Пусто: если такого таймфрейма нет (период пропускается).
     */
    public static Optional<Timeframe> fromMinutes(int minutes) {
        return Optional.ofNullable(BY_MINUTES.get(minutes));
    }

    /**
     * Разбор строки с алиасами. "1M" (месяц) и "1m" (минута) различаются регистром.
     */
    public static Optional<Timeframe> fromCode(String s) {
        if (s == null || s.isBlank()) {
            return Optional.empty();
        }
        String trimmed = s.trim();
        if ("1M".equals(trimmed) || "1mo".equalsIgnoreCase(trimmed) || "1month".equalsIgnoreCase(trimmed)) {
            return Optional.of(MON1);
        }
        return Optional.ofNullable(LOOKUP.get(norm(trimmed)));
    }
}
