package app.ankillm.generate;

import java.time.Duration;

/**
 * Attempt budget and exponential backoff between attempts, capped at {@code maxDelay}.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay
) {
    public RetryPolicy {
        maxAttempts = Math.max(maxAttempts, 1);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
    }

    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration backoff(int attempt) {
        long multiplier = 1L << Math.min(Math.max(attempt - 1, 0), 30);
        long backoffMs = baseDelay.toMillis() * multiplier;
        if (backoffMs < 0) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(backoffMs, maxDelay.toMillis()));
    }

    public boolean hasAttemptsAfter(int attempt) {
        return attempt < maxAttempts;
    }
}
