package com.taskweave.core.unit;

import java.time.Duration;

/**
 * Exponential backoff: the wait before retry {@code n} (0-based) is {@code base * 2^n},
 * capped at {@link #MAX_DELAY}.
 */
public final class Backoff {

    public static final Duration MAX_DELAY = Duration.ofMinutes(5);

    /** Blocks the calling thread. */
    public static final Sleeper THREAD_SLEEP = d -> Thread.sleep(d.toMillis());

    private final Duration base;

    public Backoff(Duration base) {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("base backoff must be zero or positive");
        }
        this.base = base;
    }

    public Duration base() {
        return base;
    }

    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (base.isZero()) {
            return Duration.ZERO;
        }
        int shift = Math.min(attempt, 30);
        long millis = base.toMillis() * (1L << shift);
        if (millis < 0 || millis > MAX_DELAY.toMillis()) {
            return MAX_DELAY;
        }
        return Duration.ofMillis(millis);
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
