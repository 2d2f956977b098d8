package uk.gegc.officeconverter.shared.rate_limit;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory fixed window limiter. The first request from a client opens a window of
 * {@code window} length; requests beyond {@code limit} inside it are denied until it closes.
 */
@Component
public class FixedWindowRateLimiter implements RateLimiter {

    private final int limit;
    private final Duration window;
    private final ConcurrentMap<String, RateWindow> windows = new ConcurrentHashMap<>();

    @Autowired
    public FixedWindowRateLimiter(RateLimitProperties properties) {
        this(properties.getRequestsPerWindow(), properties.getWindow());
    }

    public FixedWindowRateLimiter(int limit, Duration window) {
        if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.limit = limit;
        this.window = window;
    }

    @Override
    public RateLimitDecision check(String clientKey, Instant now) {
        Objects.requireNonNull(clientKey, "clientKey");
        Objects.requireNonNull(now, "now");

        // compute() holds the bin lock for this key, so read and increment are one step
        RateWindow current = windows.compute(clientKey, (key, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return RateWindow.open(now.plus(window));
            }
            if (existing.count() > limit) {
                return existing;
            }
            return existing.increment();
        });

        if (current.count() <= limit) {
            return RateLimitDecision.allow(limit - current.count(), current.resetAt());
        }
        return RateLimitDecision.deny(current.resetAt());
    }

    @Override
    public int evictExpired(Instant now) {
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        return Math.max(0, before - windows.size());
    }

    @Override
    public int trackedClients() {
        return windows.size();
    }

    public Optional<RateWindow> windowFor(String clientKey) {
        return Optional.ofNullable(windows.get(clientKey));
    }

    public int getLimit() {
        return limit;
    }

    public Duration getWindow() {
        return window;
    }
}
