package com.lumi.backend.modules.auth.presentation;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import com.lumi.backend.modules.auth.domain.DeviceMetadata;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Extracts client address and user agent from the incoming request.
 *
 * <p>{@code X-Forwarded-For} is read only when the socket peer is one of the configured trusted
 * proxies. The chain is walked from the right and the first address that is not a trusted proxy
 * is taken as the client.
 */
@Component
public class RequestDeviceResolver {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    static final int MAX_USER_AGENT_LENGTH = 512;
    static final int MAX_IP_LENGTH = 45;

    private final Set<String> trustedProxies;

    public RequestDeviceResolver(@Value("${lumi.http.trusted-proxies:}") String trustedProxies) {
        this.trustedProxies = Arrays.stream(trustedProxies.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .collect(Collectors.toUnmodifiableSet());
    }

    public DeviceMetadata resolve(HttpServletRequest request) {
        return new DeviceMetadata(resolveIp(request), resolveUserAgent(request));
    }

    private String resolveIp(HttpServletRequest request) {
        String remote = StringUtils.hasText(request.getRemoteAddr()) ? request.getRemoteAddr().trim() : null;
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (remote != null && trustedProxies.contains(remote) && StringUtils.hasText(forwarded)) {
            String client = clientFromChain(forwarded);
            if (client != null) {
                return truncate(client, MAX_IP_LENGTH);
            }
        }
        return remote != null ? truncate(remote, MAX_IP_LENGTH) : null;
    }

    private String clientFromChain(String forwarded) {
        String[] hops = forwarded.split(",");
        String leftmost = null;
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (hop.isEmpty()) {
                continue;
            }
            if (!trustedProxies.contains(hop)) {
                return hop;
            }
            leftmost = hop;
        }
        return leftmost;
    }

    private String resolveUserAgent(HttpServletRequest request) {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return StringUtils.hasText(userAgent) ? truncate(userAgent.trim(), MAX_USER_AGENT_LENGTH) : null;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
