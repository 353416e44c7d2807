package caseflow.coordinator.service;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: {@code delay(n) = min(base * 2^n, max)}.
 * Pure function of the attempt number, so it can be checked without a clock.
 */
public final class BackoffPolicy {

    private final long baseMillis;
    private final long maxMillis;

    public BackoffPolicy(Duration base, Duration max) {
        if (base == null || base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base delay must be positive");
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max delay must be at least the base delay");
        }
        this.baseMillis = base.toMillis();
        this.maxMillis = max.toMillis();
    }

    /**
     * Delay before retry number {@code attempt} (0-based).
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (attempt >= Long.SIZE - 2) {
            return Duration.ofMillis(maxMillis);
        }
        long factor = 1L << attempt;
        if (baseMillis > maxMillis / factor) {
            return Duration.ofMillis(maxMillis);
        }
        return Duration.ofMillis(Math.min(baseMillis * factor, maxMillis));
    }

    /**
     * Delay with jitter, uniform in {@code [delay/2, delay]}. Never exceeds max.
     *
     * @param random supplier of values in [0, 1)
     */
    public Duration jitteredDelay(int attempt, DoubleSupplier random) {
        long full = delay(attempt).toMillis();
        long half = full / 2;
        double r = Math.max(0.0, Math.min(1.0, random.getAsDouble()));
        return Duration.ofMillis(half + Math.round(r * (full - half)));
    }

    public Duration base() {
        return Duration.ofMillis(baseMillis);
    }

    public Duration max() {
        return Duration.ofMillis(maxMillis);
    }

    @Override
    public String toString() {
        return "BackoffPolicy{base=" + baseMillis + "ms, max=" + maxMillis + "ms}";
    }
}
