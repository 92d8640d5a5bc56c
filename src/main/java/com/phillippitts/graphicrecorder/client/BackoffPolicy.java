package com.phillippitts.graphicrecorder.client;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Capped exponential backoff with symmetric jitter.
 *
 * <p>For attempt {@code n} (1-based) the base is
 * {@code cap = min(maxBackoffMs, initialBackoffMs * 2^(n-1))} and the delay is
 * {@code round(max(0, cap + cap * jitterRatio * u))} with {@code u} uniform in [-1, 1].
 */
public final class BackoffPolicy {

    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final double jitterRatio;
    private final DoubleSupplier unitJitter;

    public BackoffPolicy(long initialBackoffMs, long maxBackoffMs, double jitterRatio) {
        this(initialBackoffMs, maxBackoffMs, jitterRatio,
                () -> ThreadLocalRandom.current().nextDouble(-1.0, 1.0));
    }

    /**
     * @param unitJitter source of {@code u}; values outside [-1, 1] are clamped
     */
    public BackoffPolicy(long initialBackoffMs, long maxBackoffMs, double jitterRatio, DoubleSupplier unitJitter) {
        if (initialBackoffMs < 0 || maxBackoffMs < 0) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (jitterRatio < 0) {
            throw new IllegalArgumentException("jitterRatio must not be negative");
        }
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.jitterRatio = jitterRatio;
        this.unitJitter = unitJitter;
    }

    public long delayMillis(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based");
        }
        double cap = cappedBase(attempt);
        double u = Math.max(-1.0, Math.min(1.0, unitJitter.getAsDouble()));
        return Math.round(Math.max(0.0, cap + cap * jitterRatio * u));
    }

    /** The un-jittered delay for {@code attempt}. */
    public double cappedBase(int attempt) {
        // 2^62 already exceeds any sane cap; avoid overflow on long outages
        double growth = Math.pow(2, Math.min(attempt - 1, 62));
        return Math.min(maxBackoffMs, initialBackoffMs * growth);
    }

    /** Upper bound of any delay: {@code maxBackoffMs * (1 + jitterRatio)}. */
    public double maxDelayMillis() {
        return maxBackoffMs * (1 + jitterRatio);
    }
}
