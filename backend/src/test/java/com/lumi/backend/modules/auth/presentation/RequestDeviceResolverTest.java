package com.lumi.backend.modules.auth.presentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.lumi.backend.modules.auth.domain.DeviceMetadata;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

class RequestDeviceResolverTest {

    private final RequestDeviceResolver resolver = new RequestDeviceResolver("10.0.0.1, 10.0.0.2");

    @Test
    void forwardedClientIsUsedBehindTrustedProxy() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.1");
        request.addHeader(RequestDeviceResolver.FORWARDED_FOR_HEADER, " 203.0.113.7 , 10.0.0.2");
        request.addHeader(HttpHeaders.USER_AGENT, " Mozilla/5.0 ");

        DeviceMetadata device = resolver.resolve(request);

        assertThat(device.ipAddress()).isEqualTo("203.0.113.7");
        assertThat(device.userAgent()).isEqualTo("Mozilla/5.0");
    }

    @Test
    void spoofedLeftmostEntryIsIgnoredBehindTrustedProxy() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.1");
        request.addHeader(RequestDeviceResolver.FORWARDED_FOR_HEADER, "1.2.3.4, 198.51.100.9");

        assertThat(resolver.resolve(request).ipAddress()).isEqualTo("198.51.100.9");
    }

    @Test
    void forwardedHeaderFromUntrustedPeerIsIgnored() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("198.51.100.2");
        request.addHeader(RequestDeviceResolver.FORWARDED_FOR_HEADER, "1.2.3.4");

        assertThat(resolver.resolve(request).ipAddress()).isEqualTo("198.51.100.2");
    }

    @Test
    void withoutTrustedProxiesTheSocketAddressAlwaysWins() {
        RequestDeviceResolver direct = new RequestDeviceResolver("");
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.1");
        request.addHeader(RequestDeviceResolver.FORWARDED_FOR_HEADER, "1.2.3.4");

        assertThat(direct.resolve(request).ipAddress()).isEqualTo("10.0.0.1");
    }

    @Test
    void fallsBackToRemoteAddressAndTruncatesUserAgent() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("198.51.100.2");
        request.addHeader(HttpHeaders.USER_AGENT, "x".repeat(600));

        DeviceMetadata device = resolver.resolve(request);

        assertThat(device.ipAddress()).isEqualTo("198.51.100.2");
        assertThat(device.userAgent()).hasSize(RequestDeviceResolver.MAX_USER_AGENT_LENGTH);
    }

    @Test
    void missingUserAgentIsNull() {
        MockHttpServletRequest request = new MockHttpServletRequest();

        assertThat(resolver.resolve(request).userAgent()).isNull();
    }
}
