package de.mirkosertic.vectorizer.embedding;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt {@code n} (1-based) waits
 * {@code min(initialBackoff * 2^(n-1), maxBackoff)} before the next attempt.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, was " + maxAttempts);
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * @param attemptNumber the attempt that just failed, starting at 1
     */
    public Duration backoffAfter(final int attemptNumber) {
        final int shift = Math.min(Math.max(attemptNumber - 1, 0), 30);
        final long millis = initialBackoff.toMillis() * (1L << shift);
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }
}
