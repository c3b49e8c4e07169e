package com.lumi.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(
        UUID userId,
        String email,
        UUID sessionId,
        List<String> roles,
        List<String> permissions
) {
}
