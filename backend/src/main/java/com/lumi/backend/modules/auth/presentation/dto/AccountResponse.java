package com.lumi.backend.modules.auth.presentation.dto;

public record AccountResponse(boolean success, UserProfileResponse user) {
}
