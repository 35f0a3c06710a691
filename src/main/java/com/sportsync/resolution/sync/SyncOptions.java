package com.sportsync.resolution.sync;

import java.time.Duration;

/**
 * Retry, timeout and thread settings for sync jobs.
 */
public class SyncOptions {

    private final int retryMaxAttempts;
    private final Duration initialBackoff;
    private final double backoffMultiplier;
    private final Duration defaultTimeout;
    private final int schedulerThreads;
    private final Duration cancelGrace;

    private SyncOptions(Builder builder) {
        this.retryMaxAttempts = builder.retryMaxAttempts;
        this.initialBackoff = builder.initialBackoff;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.defaultTimeout = builder.defaultTimeout;
        this.schedulerThreads = builder.schedulerThreads;
        this.cancelGrace = builder.cancelGrace;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Threads of the scheduler that triggers jobs; each running job also holds one worker thread.
     */
    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    /**
     * How long a timed-out run waits for its worker to stop before leaving the job in FAILED
     * until the worker exits on its own.
     */
    public Duration getCancelGrace() {
        return cancelGrace;
    }

    public static SyncOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int retryMaxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private Duration defaultTimeout = Duration.ofMinutes(5);
        private int schedulerThreads = 2;
        private Duration cancelGrace = Duration.ofSeconds(5);

        public Builder retryMaxAttempts(int retryMaxAttempts) {
            this.retryMaxAttempts = retryMaxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder schedulerThreads(int schedulerThreads) {
            this.schedulerThreads = schedulerThreads;
            return this;
        }

        public Builder cancelGrace(Duration cancelGrace) {
            this.cancelGrace = cancelGrace;
            return this;
        }

        public SyncOptions build() {
            if (retryMaxAttempts < 1) {
                throw new IllegalArgumentException("retryMaxAttempts must be >= 1");
            }
            if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
                throw new IllegalArgumentException("initialBackoff must be positive");
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
            }
            if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
                throw new IllegalArgumentException("defaultTimeout must be positive");
            }
            if (schedulerThreads < 1) {
                throw new IllegalArgumentException("schedulerThreads must be >= 1");
            }
            if (cancelGrace == null || cancelGrace.isNegative()) {
                throw new IllegalArgumentException("cancelGrace must not be negative");
            }
            return new SyncOptions(this);
        }
    }
}
