package com.reactivechat.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff calculator.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Used for broker publish retries and for the reconnect hint sent to clients when a node
 * drains, so that reconnects spread out instead of arriving at once.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap)
     * @param jitterMax Maximum jitter to add
     * @return Computed delay (base * 2^attempt capped at max, plus jitter)
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20));

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Reconnect hint with default parameters (base=1s, max=30s, jitter=5s).
     *
     * @param attempt Retry attempt number (0-based)
     * @return Computed delay
     */
    public static Duration next(int attempt) {
        return next(
                attempt,
                Duration.ofSeconds(1),
                Duration.ofSeconds(30),
                Duration.ofSeconds(5)
        );
    }
}
