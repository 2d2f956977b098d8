package uk.gegc.officeconverter.shared.rate_limit;

import java.time.Instant;

/**
 * Admission control keyed by client. Implementations own their state and must make
 * {@link #check} atomic per client key.
 */
public interface RateLimiter {

    /**
     * Records one request from {@code clientKey} at {@code now} and decides whether it is admitted.
     *
     * @param clientKey partition key, usually the client's network address
     * @param now       the time of the request
     * @return the decision with the remaining budget and the window reset time
     */
    RateLimitDecision check(String clientKey, Instant now);

    /**
     * Drops every window that has already closed at {@code now}.
     *
     * @return number of windows removed
     */
    int evictExpired(Instant now);

    /**
     * @return number of clients currently holding a window
     */
    int trackedClients();
}
