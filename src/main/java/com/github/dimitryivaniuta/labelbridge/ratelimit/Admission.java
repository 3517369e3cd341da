package com.github.dimitryivaniuta.labelbridge.ratelimit;

import java.time.Duration;

/**
 * Outcome of {@link ClientRateLimiter#admit(String)}. {@code retryAfter} is zero when allowed.
 */
public record Admission(boolean allowed, Duration retryAfter) {

    private static final Admission ALLOWED = new Admission(true, Duration.ZERO);

    public static Admission allow() {
        return ALLOWED;
    }

    public static Admission throttled(Duration retryAfter) {
        return new Admission(false, retryAfter);
    }

    /** Whole seconds for the Retry-After header, rounded up and never below 1. */
    public long retryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return Math.max(1L, (millis + 999) / 1000);
    }
}
