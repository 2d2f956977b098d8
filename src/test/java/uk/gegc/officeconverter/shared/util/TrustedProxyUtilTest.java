package uk.gegc.officeconverter.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TrustedProxyUtil")
class TrustedProxyUtilTest {

    @Test
    @DisplayName("uses the peer address when forwarded headers are disabled")
    void forwardedHeadersDisabled_usesRemoteAddress() {
        TrustedProxyUtil util = new TrustedProxyUtil(false, "");
        MockHttpServletRequest request = request("127.0.0.1", "203.0.113.7");

        assertThat(util.getClientIp(request)).isEqualTo("127.0.0.1");
    }

    @Test
    @DisplayName("uses the leftmost X-Forwarded-For entry from a trusted proxy")
    void trustedProxy_usesForwardedClient() {
        TrustedProxyUtil util = new TrustedProxyUtil(true, "10.0.0.1");
        MockHttpServletRequest request = request("10.0.0.1", "203.0.113.7, 10.0.0.1");

        assertThat(util.getClientIp(request)).isEqualTo("203.0.113.7");
    }

    @Test
    @DisplayName("ignores X-Forwarded-For from an untrusted peer")
    void untrustedPeer_ignoresForwardedHeader() {
        TrustedProxyUtil util = new TrustedProxyUtil(true, "10.0.0.1");
        MockHttpServletRequest request = request("198.51.100.4", "203.0.113.7");

        assertThat(util.getClientIp(request)).isEqualTo("198.51.100.4");
    }

    @Test
    @DisplayName("falls back to the peer address when the forwarded value is not an IP")
    void invalidForwardedValue_fallsBackToRemoteAddress() {
        TrustedProxyUtil util = new TrustedProxyUtil(true, "");
        MockHttpServletRequest request = request("127.0.0.1", "not-an-ip");

        assertThat(util.getClientIp(request)).isEqualTo("127.0.0.1");
    }

    private static MockHttpServletRequest request(String remoteAddr, String forwardedFor) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(remoteAddr);
        request.addHeader("X-Forwarded-For", forwardedFor);
        return request;
    }
}
