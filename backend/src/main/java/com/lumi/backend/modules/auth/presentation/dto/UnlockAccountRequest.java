package com.lumi.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

public record UnlockAccountRequest(@Size(max = 255, message = "reason must be at most 255 characters") String reason) {
}
