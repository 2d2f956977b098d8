package uk.gegc.officeconverter.shared.rate_limit;

import java.time.Instant;

/**
 * Per-client counter for one fixed window. Instances are immutable and replaced
 * atomically inside the limiter's map.
 */
public record RateWindow(int count, Instant resetAt) {

    static RateWindow open(Instant resetAt) {
        return new RateWindow(1, resetAt);
    }

    RateWindow increment() {
        return new RateWindow(count + 1, resetAt);
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(resetAt);
    }
}
