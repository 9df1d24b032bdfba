package com.umitunal.qdispatch.config;

/**
 * Timing, retry and pool settings for the dispatch engine.
 * All durations are in milliseconds.
 *
 * <p>Heartbeats and lease reaping must tick at least {@value #LEASE_SAFETY_FACTOR} times per lease,
 * otherwise a short pause in a healthy worker looks like a crash. {@link Builder#build()} rejects
 * configurations that break this.
 */
public class EngineConfig {
    public static final int LEASE_SAFETY_FACTOR = 3;

    private final long leaseDuration;
    private final long heartbeatInterval;
    private final long livenessWindow;
    private final long reaperInterval;
    private final long delayedSweepInterval;
    private final int defaultMaxAttempts;
    private final long defaultJobTimeout;
    private final long cancellationGrace;
    private final long backoffBase;
    private final long backoffMax;
    private final double backoffJitter;
    private final int workerCount;
    private final long pollInterval;
    private final int httpPort;

    private EngineConfig(Builder builder) {
        this.leaseDuration = builder.leaseDuration;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.livenessWindow = builder.livenessWindow > 0
                ? builder.livenessWindow
                : LEASE_SAFETY_FACTOR * builder.heartbeatInterval;
        this.reaperInterval = builder.reaperInterval;
        this.delayedSweepInterval = builder.delayedSweepInterval;
        this.defaultMaxAttempts = builder.defaultMaxAttempts;
        this.defaultJobTimeout = builder.defaultJobTimeout;
        this.cancellationGrace = builder.cancellationGrace;
        this.backoffBase = builder.backoffBase;
        this.backoffMax = builder.backoffMax;
        this.backoffJitter = builder.backoffJitter;
        this.workerCount = builder.workerCount;
        this.pollInterval = builder.pollInterval;
        this.httpPort = builder.httpPort;
    }

    public long getLeaseDuration() { return leaseDuration; }
    public long getHeartbeatInterval() { return heartbeatInterval; }
    public long getLivenessWindow() { return livenessWindow; }
    public long getReaperInterval() { return reaperInterval; }
    public long getDelayedSweepInterval() { return delayedSweepInterval; }
    public int getDefaultMaxAttempts() { return defaultMaxAttempts; }
    public long getDefaultJobTimeout() { return defaultJobTimeout; }
    public long getCancellationGrace() { return cancellationGrace; }
    public long getBackoffBase() { return backoffBase; }
    public long getBackoffMax() { return backoffMax; }
    public double getBackoffJitter() { return backoffJitter; }
    public int getWorkerCount() { return workerCount; }
    public long getPollInterval() { return pollInterval; }
    public int getHttpPort() { return httpPort; }

    public static EngineConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
            "EngineConfig{lease=%dms, heartbeat=%dms, liveness=%dms, reaper=%dms, sweep=%dms, "
                + "maxAttempts=%d, timeout=%dms, workers=%d}",
            leaseDuration, heartbeatInterval, livenessWindow, reaperInterval, delayedSweepInterval,
            defaultMaxAttempts, defaultJobTimeout, workerCount
        );
    }

    public static class Builder {
        private long leaseDuration = 30_000;
        private long heartbeatInterval = 5_000;
        private long livenessWindow = -1;
        private long reaperInterval = 5_000;
        private long delayedSweepInterval = 1_000;
        private int defaultMaxAttempts = 3;
        private long defaultJobTimeout = 60_000;
        private long cancellationGrace = 2_000;
        private long backoffBase = 1_000;
        private long backoffMax = 60_000;
        private double backoffJitter = 0.2;
        private int workerCount = 4;
        private long pollInterval = 500;
        private int httpPort = 8080;

        private Builder() {
        }

        /**
         * How long a claimed job stays hidden from other workers.
         * Default: 30 seconds
         */
        public Builder withLeaseDuration(long millis) {
            this.leaseDuration = millis;
            return this;
        }

        /**
         * Default: 5 seconds
         */
        public Builder withHeartbeatInterval(long millis) {
            this.heartbeatInterval = millis;
            return this;
        }

        /**
         * Silence after which a worker is declared dead.
         * Default: 3 x heartbeat interval
         */
        public Builder withLivenessWindow(long millis) {
            this.livenessWindow = millis;
            return this;
        }

        public Builder withReaperInterval(long millis) {
            this.reaperInterval = millis;
            return this;
        }

        public Builder withDelayedSweepInterval(long millis) {
            this.delayedSweepInterval = millis;
            return this;
        }

        public Builder withDefaultMaxAttempts(int attempts) {
            this.defaultMaxAttempts = attempts;
            return this;
        }

        /**
         * Execution deadline for jobs enqueued without their own timeout.
         * Default: 60 seconds
         */
        public Builder withDefaultJobTimeout(long millis) {
            this.defaultJobTimeout = millis;
            return this;
        }

        /**
         * How long a timed-out execution may keep running after cancellation is signalled
         * before the supervisor stops waiting for it.
         * Default: 2 seconds
         */
        public Builder withCancellationGrace(long millis) {
            this.cancellationGrace = millis;
            return this;
        }

        /**
         * Retry backoff: {@code base * 2^attempts}, capped at {@code max}, randomized by {@code jitter}.
         */
        public Builder withBackoff(long baseMillis, long maxMillis, double jitter) {
            this.backoffBase = baseMillis;
            this.backoffMax = maxMillis;
            this.backoffJitter = jitter;
            return this;
        }

        public Builder withWorkerCount(int count) {
            this.workerCount = count;
            return this;
        }

        public Builder withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        public Builder withHttpPort(int port) {
            this.httpPort = port;
            return this;
        }

        public EngineConfig build() {
            requirePositive("leaseDuration", leaseDuration);
            requirePositive("heartbeatInterval", heartbeatInterval);
            requirePositive("reaperInterval", reaperInterval);
            requirePositive("delayedSweepInterval", delayedSweepInterval);
            requirePositive("defaultJobTimeout", defaultJobTimeout);
            requirePositive("pollInterval", pollInterval);
            if (cancellationGrace < 0) {
                throw new IllegalArgumentException("cancellationGrace must not be negative");
            }
            if (defaultMaxAttempts < 1) {
                throw new IllegalArgumentException("defaultMaxAttempts must be at least 1");
            }
            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount must be at least 1");
            }
            if (backoffBase < 0 || backoffMax < backoffBase) {
                throw new IllegalArgumentException("backoff requires 0 <= base <= max");
            }
            if (backoffJitter < 0 || backoffJitter >= 1) {
                throw new IllegalArgumentException("backoffJitter must be in [0, 1)");
            }
            if (heartbeatInterval * LEASE_SAFETY_FACTOR > leaseDuration) {
                throw new IllegalArgumentException(
                    "heartbeatInterval must not exceed leaseDuration / " + LEASE_SAFETY_FACTOR);
            }
            if (reaperInterval * LEASE_SAFETY_FACTOR > leaseDuration) {
                throw new IllegalArgumentException(
                    "reaperInterval must not exceed leaseDuration / " + LEASE_SAFETY_FACTOR);
            }
            if (livenessWindow > 0 && livenessWindow <= heartbeatInterval) {
                throw new IllegalArgumentException("livenessWindow must be longer than heartbeatInterval");
            }
            return new EngineConfig(this);
        }

        private static void requirePositive(String name, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
