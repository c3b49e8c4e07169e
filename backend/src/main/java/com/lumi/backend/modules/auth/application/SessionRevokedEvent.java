package com.lumi.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record SessionRevokedEvent(UUID userId, List<UUID> sessionIds, String reason, OffsetDateTime revokedAt) {
}
