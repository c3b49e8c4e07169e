package com.lumi.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record VerificationResentResponse(boolean success, OffsetDateTime verificationExpiresAt) {
}
