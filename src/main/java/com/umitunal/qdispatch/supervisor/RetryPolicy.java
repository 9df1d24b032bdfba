package com.umitunal.qdispatch.supervisor;

import com.umitunal.qdispatch.config.EngineConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 *
 * <p>The delay after {@code attempts} consumed attempts is {@code base * 2^attempts}, capped at
 * {@code max}, then scaled by a random factor in {@code [1 - jitter, 1 + jitter]} so that jobs failing
 * together do not come back together. The result never exceeds {@code max}.
 */
public final class RetryPolicy {
    private final long baseDelay;
    private final long maxDelay;
    private final double jitter;
    private final DoubleSupplier random;

    public RetryPolicy(long baseDelay, long maxDelay, double jitter) {
        this(baseDelay, maxDelay, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in {@code [0, 1)}
     */
    public RetryPolicy(long baseDelay, long maxDelay, double jitter, DoubleSupplier random) {
        if (baseDelay < 0 || maxDelay < baseDelay) {
            throw new IllegalArgumentException("backoff requires 0 <= base <= max");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
    }

    public static RetryPolicy from(EngineConfig config) {
        return new RetryPolicy(config.getBackoffBase(), config.getBackoffMax(), config.getBackoffJitter());
    }

    /**
     * Fixed delays without jitter, for deterministic scheduling.
     */
    public static RetryPolicy withoutJitter(long baseDelay, long maxDelay) {
        return new RetryPolicy(baseDelay, maxDelay, 0, () -> 0.5);
    }

    /**
     * Delay in milliseconds before the next attempt becomes eligible.
     *
     * @param attempts attempts consumed so far
     */
    public long delay(int attempts) {
        double exponential = baseDelay * Math.pow(2, Math.max(0, Math.min(attempts, 62)));
        double capped = Math.min(exponential, maxDelay);
        double factor = 1 + jitter * (2 * random.getAsDouble() - 1);
        long delay = Math.round(capped * factor);
        return Math.max(0, Math.min(delay, maxDelay));
    }

    public long getBaseDelay() { return baseDelay; }
    public long getMaxDelay() { return maxDelay; }
    public double getJitter() { return jitter; }
}
