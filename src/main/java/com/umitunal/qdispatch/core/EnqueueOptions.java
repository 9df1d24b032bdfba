package com.umitunal.qdispatch.core;

/**
 * Per-job submission options. Unset values fall back to the engine defaults.
 */
public class EnqueueOptions {
    private static final EnqueueOptions DEFAULTS = newBuilder().build();

    private final int maxAttempts;
    private final long delayMillis;
    private final long timeoutMillis;

    private EnqueueOptions(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.delayMillis = builder.delayMillis;
        this.timeoutMillis = builder.timeoutMillis;
    }

    /**
     * Max attempts, or 0 when the engine default applies.
     */
    public int getMaxAttempts() { return maxAttempts; }
    public long getDelayMillis() { return delayMillis; }

    /**
     * Execution deadline, or 0 when the engine default applies.
     */
    public long getTimeoutMillis() { return timeoutMillis; }

    public static EnqueueOptions defaults() {
        return DEFAULTS;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts;
        private long delayMillis;
        private long timeoutMillis;

        private Builder() {
        }

        public Builder withMaxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Keep the job DELAYED for this long before it becomes claimable.
         */
        public Builder withDelay(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("delay must not be negative: " + millis);
            }
            this.delayMillis = millis;
            return this;
        }

        public Builder withTimeout(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("timeout must not be negative: " + millis);
            }
            this.timeoutMillis = millis;
            return this;
        }

        public EnqueueOptions build() {
            return new EnqueueOptions(this);
        }
    }
}
