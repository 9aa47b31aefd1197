package com.octate.collab.client;

import java.time.Duration;

/**
 * Exponential backoff: {@code delay(n) = min(base * 2^n, max)} for attempts
 * {@code 0 .. maxAttempts - 1}.
 */
public record ReconnectPolicy(long baseMs, long maxMs, int maxAttempts) {

    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(1000, 30000, 10);
    }

    public Duration delay(int attempt) {
        // capped shift keeps base * factor inside long range
        long factor = 1L << Math.min(attempt, 30);
        long millis = baseMs > maxMs / factor ? maxMs : Math.min(baseMs * factor, maxMs);
        return Duration.ofMillis(millis);
    }

    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
