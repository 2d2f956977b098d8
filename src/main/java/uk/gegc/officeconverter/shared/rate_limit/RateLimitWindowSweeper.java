package uk.gegc.officeconverter.shared.rate_limit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitWindowSweeper {

    private final RateLimiter rateLimiter;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.rate-limit.sweep-interval:PT5M}",
            initialDelayString = "${app.rate-limit.sweep-interval:PT5M}")
    public void purgeExpiredWindows() {
        try {
            int removed = rateLimiter.evictExpired(clock.instant());
            log.debug("Rate limit sweep removed {} expired windows, {} still tracked",
                    removed, rateLimiter.trackedClients());
        } catch (Exception e) {
            log.error("Failed to sweep expired rate limit windows", e);
        }
    }
}
