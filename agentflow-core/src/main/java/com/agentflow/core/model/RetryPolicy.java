package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Retry configuration of a single step.
 *
 * Invariants (checked by the validator, not here):
 * - maxAttempts >= 1
 * - delay >= 0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetryPolicy(
    Integer maxAttempts,
    Long delay,
    BackoffStrategy backoff
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_DELAY_MS = 1000L;

    public RetryPolicy {
        if (maxAttempts == null) {
            maxAttempts = DEFAULT_MAX_ATTEMPTS;
        }
        if (delay == null) {
            delay = DEFAULT_DELAY_MS;
        }
        if (backoff == null) {
            backoff = BackoffStrategy.EXPONENTIAL;
        }
    }

    /**
     * Default retry policy: 3 attempts, exponential backoff starting at 1s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(null, null, null);
    }

    /**
     * Single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0L, BackoffStrategy.LINEAR);
    }

    /**
     * Compute the delay to wait after the given failed attempt.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     * @return delay in milliseconds
     */
    public long computeDelay(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        if (backoff == BackoffStrategy.LINEAR) {
            return delay;
        }
        // delay * 2^(attempt - 1), saturating instead of overflowing
        int shift = Math.min(attemptNumber - 1, 62);
        long factor = 1L << shift;
        if (delay != 0 && factor > Long.MAX_VALUE / delay) {
            return Long.MAX_VALUE;
        }
        return delay * factor;
    }

    /**
     * Check if more attempts are available.
     *
     * @param currentAttempt Current attempt number (1-indexed)
     * @return true if more attempts can be made
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer maxAttempts;
        private Long delay;
        private BackoffStrategy backoff;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder delay(long delayMs) {
            this.delay = delayMs;
            return this;
        }

        public Builder backoff(BackoffStrategy backoff) {
            this.backoff = backoff;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, delay, backoff);
        }
    }
}
