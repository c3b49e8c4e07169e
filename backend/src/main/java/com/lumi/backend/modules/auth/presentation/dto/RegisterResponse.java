package com.lumi.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record RegisterResponse(UserProfileResponse user, OffsetDateTime verificationExpiresAt) {
}
