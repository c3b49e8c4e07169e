package com.lumi.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record LogoutResponse(boolean success, UUID sessionId) {
}
