package com.lumi.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record RefreshResponse(UserProfileResponse user, TokenPairResponse tokens, UUID sessionId) {
}
