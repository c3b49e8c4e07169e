package com.lumi.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String email,
        String firstName,
        String lastName,
        String phone,
        boolean emailVerified,
        String status,
        List<String> roles,
        List<String> permissions,
        boolean isAdmin,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
