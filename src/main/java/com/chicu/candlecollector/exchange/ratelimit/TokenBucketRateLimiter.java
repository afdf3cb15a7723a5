package com.chicu.candlecollector.exchange.ratelimit;

import com.chicu.candlecollector.common.time.Sleeper;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Token bucket: пополняется равномерно (requestsPerMinute / 60 в секунду),
 * ёмкость burst позволяет короткие всплески.
 *
 * acquire() держит монитор во время ожидания: воркеры одной биржи
 * встают в очередь, чужие биржи не затрагиваются.
 */
public class TokenBucketRateLimiter implements ExchangeRateLimiter {

    private static final long NANOS_PER_MINUTE = 60_000_000_000L;

    private final int requestsPerMinute;
    private final double capacity;
    private final double tokensPerNano;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int requestsPerMinute, int burst) {
        this(requestsPerMinute, burst, System::nanoTime, Sleeper.system());
    }

    public TokenBucketRateLimiter(int requestsPerMinute,
                                  int burst,
                                  LongSupplier nanoTime,
                                  Sleeper sleeper) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be > 0");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.capacity = Math.max(1, burst);
        this.tokensPerNano = (double) requestsPerMinute / NANOS_PER_MINUTE;
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    @Override
    public synchronized void acquire(int permits) throws InterruptedException {
        double need = Math.min(Math.max(1, permits), capacity);

        while (true) {
            refill();
            if (tokens >= need) {
                tokens -= need;
                return;
            }
            long waitNanos = (long) Math.ceil((need - tokens) / tokensPerNano);
            sleeper.sleep(Duration.ofNanos(Math.max(waitNanos, 1_000_000L)));
        }
    }

    @Override
    public synchronized boolean tryAcquire(int permits) {
        double need = Math.min(Math.max(1, permits), capacity);
        refill();
        if (tokens >= need) {
            tokens -= need;
            return true;
        }
        return false;
    }

    @Override
    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }
}
