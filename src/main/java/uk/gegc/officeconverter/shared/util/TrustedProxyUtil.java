package uk.gegc.officeconverter.shared.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Resolves the client key used for rate limiting.
 */
@Component
public class TrustedProxyUtil {

    private final boolean enableForwardedHeaders;
    private final List<String> trustedProxies;

    public TrustedProxyUtil(
            @Value("${app.security.enable-forwarded-headers:false}") boolean enableForwardedHeaders,
            @Value("${app.security.trusted-proxies:}") String trustedProxiesConfig) {
        this.enableForwardedHeaders = enableForwardedHeaders;
        this.trustedProxies = parseTrustedProxies(trustedProxiesConfig);
    }

    /**
     * Safely extracts the client IP address from the request,
     * respecting X-Forwarded-For header only from trusted proxies.
     *
     * @param request The HTTP request
     * @return The client IP address
     */
    public String getClientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!enableForwardedHeaders) {
            return remoteAddr;
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor == null || forwardedFor.trim().isEmpty()) {
            return remoteAddr;
        }

        if (!isTrustedProxy(remoteAddr)) {
            return remoteAddr; // Don't trust X-Forwarded-For from untrusted sources
        }

        // Leftmost entry is the original client
        String clientIp = forwardedFor.split(",")[0].trim();
        if (isValidIpAddress(clientIp)) {
            return clientIp;
        }

        return remoteAddr;
    }

    private boolean isTrustedProxy(String ip) {
        if (ip == null) {
            return false;
        }
        return trustedProxies.contains(ip) ||
               trustedProxies.stream().anyMatch(ip::startsWith);
    }

    private static List<String> parseTrustedProxies(String config) {
        if (config == null || config.trim().isEmpty()) {
            return List.of("127.0.0.1", "::1", "0:0:0:0:0:0:0:1");
        }
        return Arrays.stream(config.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
    }

    private boolean isValidIpAddress(String ip) {
        if (ip == null || ip.trim().isEmpty()) {
            return false;
        }

        String[] parts = ip.split("\\.");
        if (parts.length == 4) {
            try {
                for (String part : parts) {
                    int num = Integer.parseInt(part);
                    if (num < 0 || num > 255) {
                        return false;
                    }
                }
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }

        // IPv6, simplified
        if (ip.contains(":")) {
            return ip.matches("^[0-9a-fA-F:]+$");
        }

        return false;
    }
}
