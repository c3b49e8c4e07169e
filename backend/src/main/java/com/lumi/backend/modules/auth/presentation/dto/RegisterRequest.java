package com.lumi.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "password is required") String password,
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        @Size(max = 32) String phone
) {
}
