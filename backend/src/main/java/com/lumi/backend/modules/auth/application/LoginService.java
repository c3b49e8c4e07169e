package com.lumi.backend.modules.auth.application;

import com.lumi.backend.modules.auth.domain.DeviceMetadata;
import com.lumi.backend.modules.auth.presentation.dto.LoginRequest;
import com.lumi.backend.modules.auth.presentation.dto.LoginResponse;

import org.springframework.stereotype.Service;

/**
 * Password login entry point. The progressive delay runs before {@link AuthService#login} opens
 * its transaction, so a throttled caller holds no database connection while it waits.
 */
@Service
public class LoginService {

    private final BruteForceGuard bruteForceGuard;
    private final AuthService authService;

    public LoginService(BruteForceGuard bruteForceGuard, AuthService authService) {
        this.bruteForceGuard = bruteForceGuard;
        this.authService = authService;
    }

    public LoginResponse login(LoginRequest request, DeviceMetadata device) {
        bruteForceGuard.applyDelay(request.email());
        return authService.login(request, device);
    }
}
