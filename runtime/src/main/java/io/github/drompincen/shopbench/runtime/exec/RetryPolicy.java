package io.github.drompincen.shopbench.runtime.exec;

import java.time.Duration;

/**
 * Bounded attempts with linear backoff: after failed attempt {@code n} the
 * executor waits {@code backoff * n}.
 */
public record RetryPolicy(int retryCount, Duration backoff) {

    public static final int DEFAULT_RETRY_COUNT = 2;
    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(5);

    public RetryPolicy {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, got " + retryCount);
        }
        backoff = backoff != null ? backoff : Duration.ZERO;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_RETRY_COUNT, DEFAULT_BACKOFF);
    }

    public int totalAttempts() {
        return retryCount + 1;
    }

    public Duration delayAfter(int attempt) {
        return backoff.multipliedBy(attempt);
    }
}
