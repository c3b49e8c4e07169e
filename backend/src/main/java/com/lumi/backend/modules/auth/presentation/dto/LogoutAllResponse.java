package com.lumi.backend.modules.auth.presentation.dto;

public record LogoutAllResponse(int revokedCount) {
}
