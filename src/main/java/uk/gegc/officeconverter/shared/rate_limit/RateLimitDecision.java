package uk.gegc.officeconverter.shared.rate_limit;

import java.time.Instant;

/**
 * Outcome of a single admission check.
 *
 * @param allowed   whether the request may proceed
 * @param remaining requests still available in the current window
 * @param resetAt   instant at which the current window closes
 */
public record RateLimitDecision(
        boolean allowed,
        int remaining,
        Instant resetAt
) {
    public static RateLimitDecision allow(int remaining, Instant resetAt) {
        return new RateLimitDecision(true, Math.max(0, remaining), resetAt);
    }

    public static RateLimitDecision deny(Instant resetAt) {
        return new RateLimitDecision(false, 0, resetAt);
    }

    public long resetEpochSeconds() {
        return resetAt.getEpochSecond();
    }
}
