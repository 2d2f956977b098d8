package uk.gegc.officeconverter.shared.rate_limit;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.officeconverter.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimitService {

    private final RateLimiter rateLimiter;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    /**
     * Admits a request from the given client or rejects it.
     *
     * @param clientKey the client's network address
     * @return the decision for an admitted request
     * @throws RateLimitExceededException when the client has used up its window
     */
    public RateLimitDecision admit(String clientKey) {
        Instant now = clock.instant();
        RateLimitDecision decision = rateLimiter.check(clientKey, now);
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded for client {}, window resets at {}", clientKey, decision.resetAt());
            meterRegistry.counter("rate_limit.rejections").increment();
            throw new RateLimitExceededException("Too many requests, try again after " + decision.resetAt(), decision, now);
        }
        log.debug("Admitted request from {} ({} remaining)", clientKey, decision.remaining());
        return decision;
    }
}
