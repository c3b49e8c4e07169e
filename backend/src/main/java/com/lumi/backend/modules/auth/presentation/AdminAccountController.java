package com.lumi.backend.modules.auth.presentation;

import java.util.UUID;

import com.lumi.backend.global.security.SecurityUtils;
import com.lumi.backend.modules.auth.application.AuthService;
import com.lumi.backend.modules.auth.presentation.dto.UnlockAccountRequest;
import com.lumi.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
public class AdminAccountController {

    private final AuthService authService;

    public AdminAccountController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Unlock account", description = "Clears lockout state and failure counters and reactivates the account.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Account unlocked"),
            @ApiResponse(responseCode = "403", description = "Admin role required"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PostMapping("/{userId}/unlock")
    public ResponseEntity<UserProfileResponse> unlock(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody(required = false) UnlockAccountRequest request
    ) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(authService.unlockAccount(userId, SecurityUtils.getCurrentUserId(), reason));
    }
}
