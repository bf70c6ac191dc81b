package dev.contentagents.backend;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry budget and backoff schedule for one logical generation request.
 *
 * @param maxRetries  total number of attempts made before giving up on transient failures
 * @param baseDelay   delay before the first retry
 * @param maxDelay    upper bound for any single delay
 * @param backoff     how the delay grows with each retry
 * @param callTimeout bound on a single backend call; zero disables it
 */
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    BackoffStrategy backoff,
    Duration callTimeout
) {
    public RetryPolicy {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1: " + maxRetries);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (baseDelay.isNegative() || maxDelay.isNegative() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("Durations must not be negative");
        }
    }

    public static RetryPolicy exponential(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, Duration.ofMinutes(5), BackoffStrategy.EXPONENTIAL, Duration.ZERO);
    }

    public RetryPolicy withCallTimeout(Duration timeout) {
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoff, timeout);
    }

    /**
     * Delay to wait before retry number {@code retry} (1-based). Pure: depends only on
     * the policy and the retry number.
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1: " + retry);
        }
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        long millis;
        if (backoff == BackoffStrategy.LINEAR) {
            millis = base > cap / retry ? cap : base * retry;
        } else {
            int shift = retry - 1;
            millis = shift >= 62 || base > (cap >> shift) ? cap : base << shift;
        }
        return Duration.ofMillis(Math.min(millis, cap));
    }
}
