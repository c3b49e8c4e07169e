package com.lumi.backend.modules.auth.presentation;

import com.lumi.backend.global.security.JwtAuthenticationPrincipal;
import com.lumi.backend.modules.auth.application.AuthService;
import com.lumi.backend.modules.auth.application.LoginService;
import com.lumi.backend.modules.auth.presentation.dto.AccountResponse;
import com.lumi.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.lumi.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.lumi.backend.modules.auth.presentation.dto.LoginRequest;
import com.lumi.backend.modules.auth.presentation.dto.LoginResponse;
import com.lumi.backend.modules.auth.presentation.dto.LogoutAllResponse;
import com.lumi.backend.modules.auth.presentation.dto.LogoutResponse;
import com.lumi.backend.modules.auth.presentation.dto.RefreshRequest;
import com.lumi.backend.modules.auth.presentation.dto.RefreshResponse;
import com.lumi.backend.modules.auth.presentation.dto.RegisterRequest;
import com.lumi.backend.modules.auth.presentation.dto.RegisterResponse;
import com.lumi.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.lumi.backend.modules.auth.presentation.dto.SuccessResponse;
import com.lumi.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.lumi.backend.modules.auth.presentation.dto.VerificationResentResponse;
import com.lumi.backend.modules.auth.presentation.dto.VerifyEmailRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final LoginService loginService;
    private final RequestDeviceResolver deviceResolver;

    public AuthController(AuthService authService, LoginService loginService, RequestDeviceResolver deviceResolver) {
        this.authService = authService;
        this.loginService = loginService;
        this.deviceResolver = deviceResolver;
    }

    @Operation(summary = "Register", description = "Creates an account and sends the verification email.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "409", description = "Email already registered (`email_taken`)"),
            @ApiResponse(responseCode = "422", description = "Invalid input or weak password")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request,
                                                     HttpServletRequest httpRequest) {
        RegisterResponse response = authService.register(request, deviceResolver.resolve(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Login", description = "Verifies credentials and opens a new session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session issued"),
            @ApiResponse(responseCode = "401", description = "`invalid_credentials`, `account_locked` or `account_inactive`")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        return ResponseEntity.ok(loginService.login(request, deviceResolver.resolve(httpRequest)));
    }

    @Operation(summary = "Refresh tokens", description = "Rotates the refresh token of the session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Tokens rotated"),
            @ApiResponse(responseCode = "401", description = "Invalid, expired or reused refresh token")
    })
    @PostMapping("/refresh")
    public ResponseEntity<RefreshResponse> refresh(@Valid @RequestBody RefreshRequest request,
                                                   HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.refresh(request, deviceResolver.resolve(httpRequest)));
    }

    @PostMapping("/logout")
    public ResponseEntity<LogoutResponse> logout(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.logout(principal.sessionId(), principal.userId()));
    }

    @PostMapping("/logout-all")
    public ResponseEntity<LogoutAllResponse> logoutAll(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.logoutAll(principal.userId()));
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.getProfile(principal.userId()));
    }

    @Operation(summary = "Verify email")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Email verified"),
            @ApiResponse(responseCode = "401", description = "Token secret mismatch; all sessions revoked"),
            @ApiResponse(responseCode = "422", description = "Malformed, unknown, consumed or expired token")
    })
    @PostMapping("/verify-email")
    public ResponseEntity<AccountResponse> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        return ResponseEntity.ok(authService.verifyEmail(request.token()));
    }

    @PostMapping("/resend-verification")
    public ResponseEntity<VerificationResentResponse> resendVerification(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.resendVerification(principal.userId()));
    }

    @Operation(summary = "Request password reset", description = "Always succeeds so callers cannot tell which emails have accounts.")
    @PostMapping("/forgot-password")
    public ResponseEntity<SuccessResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request,
                                                          HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.requestPasswordReset(request.email(), deviceResolver.resolve(httpRequest)));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<AccountResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request,
                                                         HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.resetPassword(request, deviceResolver.resolve(httpRequest)));
    }

    @PutMapping("/change-password")
    public ResponseEntity<AccountResponse> changePassword(@AuthenticationPrincipal JwtAuthenticationPrincipal principal,
                                                          @Valid @RequestBody ChangePasswordRequest request,
                                                          HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.changePassword(
                principal.userId(), principal.sessionId(), request, deviceResolver.resolve(httpRequest)));
    }
}
