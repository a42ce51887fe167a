package org.tanzu.pvemcp.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with linearly increasing delay: the n-th retry waits
 * {@code n * baseDelay}.
 */
public final class RetryPolicy {

    /** Policy that never retries */
    public static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO);

    private final int maxRetries;
    private final Duration baseDelay;

    public RetryPolicy(int maxRetries, Duration baseDelay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
    }

    public static RetryPolicy linear(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay);
    }

    public int getMaxRetries() { return maxRetries; }
    public Duration getBaseDelay() { return baseDelay; }

    /**
     * Gets the pause before a retry.
     * @param retry One-based retry number
     * @return {@code retry * baseDelay}
     */
    public Duration delayBefore(int retry) {
        return baseDelay.multipliedBy(Math.max(retry, 0));
    }

    /**
     * Same backoff, different budget.
     * @param retries The retry budget
     * @return A policy with the given budget
     */
    public RetryPolicy withMaxRetries(int retries) {
        return retries == maxRetries ? this : new RetryPolicy(retries, baseDelay);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", baseDelay=" + baseDelay + "}";
    }
}
