package com.lumi.backend.global.security;

import java.util.UUID;

import com.lumi.backend.global.error.UnauthorizedProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new UnauthorizedProblemException("unauthorized", "Authentication is required");
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    public static UUID getCurrentSessionId() {
        return getCurrentPrincipal().sessionId();
    }
}
