package com.lumi.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionFingerprintMismatchEvent(
        UUID userId,
        UUID sessionId,
        String ipAddress,
        String userAgent,
        OffsetDateTime detectedAt
) {
}
