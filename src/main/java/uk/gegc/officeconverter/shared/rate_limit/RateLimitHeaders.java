package uk.gegc.officeconverter.shared.rate_limit;

import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;

public final class RateLimitHeaders {

    public static final String REMAINING = "X-Rate-Limit-Remaining";
    public static final String RESET = "X-Rate-Limit-Reset";

    private RateLimitHeaders() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static void apply(HttpServletResponse response, RateLimitDecision decision) {
        response.setHeader(REMAINING, String.valueOf(decision.remaining()));
        response.setHeader(RESET, String.valueOf(decision.resetEpochSeconds()));
    }

    public static HttpHeaders of(RateLimitDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(REMAINING, String.valueOf(decision.remaining()));
        headers.set(RESET, String.valueOf(decision.resetEpochSeconds()));
        return headers;
    }
}
