package uk.gegc.officeconverter.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.officeconverter.shared.rate_limit.RateLimitDecision;

import java.time.Duration;
import java.time.Instant;

@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class RateLimitExceededException extends RuntimeException {
    private final RateLimitDecision decision;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, RateLimitDecision decision, Instant now) {
        super(message);
        this.decision = decision;
        long secondsLeft = Duration.between(now, decision.resetAt()).toSeconds();
        this.retryAfterSeconds = Math.max(1, secondsLeft);
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
