package com.lumi.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record LoginResponse(UserProfileResponse user, TokenPairResponse tokens, UUID sessionId, boolean emailVerified) {
}
