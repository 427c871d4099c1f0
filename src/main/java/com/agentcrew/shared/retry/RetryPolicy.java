package com.agentcrew.shared.retry;

/**
 * Bounded exponential backoff: up to {@code maxAttempts} calls, waiting
 * {@code initialBackoffMs} after the first failure and doubling up to {@code maxBackoffMs}.
 */
public record RetryPolicy(
    int maxAttempts,
    long initialBackoffMs,
    long maxBackoffMs
) {
    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialBackoffMs < 0) throw new IllegalArgumentException("initialBackoffMs must be >= 0");
        maxBackoffMs = Math.max(maxBackoffMs, initialBackoffMs);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 500, 10_000);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0, 0);
    }
}
