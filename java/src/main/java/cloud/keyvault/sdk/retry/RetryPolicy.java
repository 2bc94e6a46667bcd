package cloud.keyvault.sdk.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry policy with exponential backoff.
 *
 * @param maxAttempts total attempts including the first; zero means the operation is never invoked
 * @param initialDelay delay before the second attempt
 * @param maxDelay cap applied to every computed delay
 * @param multiplier growth factor between consecutive delays, {@code 1.0} for a fixed delay
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {

    public static final int DEFAULT_MAX_ATTEMPTS = 4;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return exponential(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY);
    }

    public static RetryPolicy fixed(int attempts, Duration delay) {
        return new RetryPolicy(attempts, delay, delay, 1.0);
    }

    public static RetryPolicy exponential(int attempts, Duration initialDelay) {
        Duration cap = initialDelay.compareTo(DEFAULT_MAX_DELAY) > 0 ? initialDelay : DEFAULT_MAX_DELAY;
        return new RetryPolicy(attempts, initialDelay, cap, 2.0);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, initialDelay, maxDelay, multiplier);
    }

    /**
     * Delay to wait before the given attempt.
     *
     * @param attempt 1-based attempt number
     * @return zero for the first attempt, otherwise {@code initialDelay * multiplier^(attempt - 2)} capped at
     *     {@code maxDelay}
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 2);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
