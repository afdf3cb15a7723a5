package com.chicu.candlecollector.common.time;

import java.time.Duration;

/**
 * Пауза потока. Выделена, чтобы тесты не спали по-настоящему.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> {
            if (!d.isNegative() && !d.isZero()) {
                Thread.sleep(d.toMillis());
            }
        };
    }
}
