package com.lumi.backend.modules.auth.application;

import static com.lumi.backend.modules.auth.application.AuthEventDispatcher.payload;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.lumi.backend.global.config.AuthProperties;
import com.lumi.backend.global.error.ConflictProblemException;
import com.lumi.backend.global.error.NotFoundProblemException;
import com.lumi.backend.global.error.UnauthorizedProblemException;
import com.lumi.backend.global.error.ValidationProblemException;
import com.lumi.backend.modules.audit.domain.SecurityEventSeverity;
import com.lumi.backend.modules.audit.application.SecurityEventService.SecurityEventCommand;
import com.lumi.backend.modules.audit.domain.SecurityEventTypes;
import com.lumi.backend.modules.auth.application.AccountLockoutPolicy.FailureOutcome;
import com.lumi.backend.modules.auth.application.BruteForceGuard.BruteForceResult;
import com.lumi.backend.modules.auth.application.OpaqueTokenCodec.HashedSecret;
import com.lumi.backend.modules.auth.application.OpaqueTokenCodec.ParsedToken;
import com.lumi.backend.modules.auth.application.SessionService.NewSession;
import com.lumi.backend.modules.auth.application.TokenService.AccessTokenClaims;
import com.lumi.backend.modules.auth.application.TokenService.GeneratedToken;
import com.lumi.backend.modules.auth.application.TokenService.IssuedRefreshToken;
import com.lumi.backend.modules.auth.application.TokenService.RotatedTokens;
import com.lumi.backend.modules.auth.application.TokenService.VerifiedRefreshToken;
import com.lumi.backend.modules.auth.domain.AbstractSingleUseToken;
import com.lumi.backend.modules.auth.domain.DeviceMetadata;
import com.lumi.backend.modules.auth.domain.EmailVerificationToken;
import com.lumi.backend.modules.auth.domain.PasswordResetToken;
import com.lumi.backend.modules.auth.domain.UserAccount;
import com.lumi.backend.modules.auth.domain.UserAccountStatus;
import com.lumi.backend.modules.auth.domain.UserRole;
import com.lumi.backend.modules.auth.domain.UserSession;
import com.lumi.backend.modules.auth.infrastructure.persistence.EmailVerificationTokenRepository;
import com.lumi.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;
import com.lumi.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.lumi.backend.modules.auth.presentation.dto.AccountResponse;
import com.lumi.backend.modules.auth.presentation.dto.ChangePasswordRequest;
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
import com.lumi.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.lumi.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.lumi.backend.modules.auth.presentation.dto.VerificationResentResponse;
import com.lumi.backend.modules.notification.application.AuthMailer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Account and session lifecycle. Each public method is one transaction that still commits when
 * it ends in a {@link ResponseStatusException}, so failure counters and defensive revocations
 * survive the error response.
 *
 * <p>Login, password-reset issuance and verification resend lock the account row, so concurrent
 * requests for one account run one after another. The progressive login delay is applied by
 * {@link LoginService} before the transaction opens.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String DEFAULT_ROLE_CODE = "CUSTOMER";
    static final String ADMIN_ROLE_CODE = "ADMIN";
    static final String INVALID_CREDENTIALS_MESSAGE =
            "Invalid credentials. Please check your email and password combination.";

    private final UserAccountRepository userAccountRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final EmailVerificationTokenRepository emailVerificationTokenRepository;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final OpaqueTokenCodec tokenCodec;
    private final TokenService tokenService;
    private final SessionService sessionService;
    private final DeviceFingerprintService deviceFingerprintService;
    private final BruteForceGuard bruteForceGuard;
    private final AccountLockoutPolicy lockoutPolicy;
    private final RbacService rbacService;
    private final AuthEventDispatcher events;
    private final AuthProperties authProperties;
    private final Clock clock;

    public AuthService(
            UserAccountRepository userAccountRepository,
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            EmailVerificationTokenRepository emailVerificationTokenRepository,
            PasswordResetTokenRepository passwordResetTokenRepository,
            PasswordHasher passwordHasher,
            PasswordPolicy passwordPolicy,
            OpaqueTokenCodec tokenCodec,
            TokenService tokenService,
            SessionService sessionService,
            DeviceFingerprintService deviceFingerprintService,
            BruteForceGuard bruteForceGuard,
            AccountLockoutPolicy lockoutPolicy,
            RbacService rbacService,
            AuthEventDispatcher events,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.emailVerificationTokenRepository = emailVerificationTokenRepository;
        this.passwordResetTokenRepository = passwordResetTokenRepository;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
        this.tokenCodec = tokenCodec;
        this.tokenService = tokenService;
        this.sessionService = sessionService;
        this.deviceFingerprintService = deviceFingerprintService;
        this.bruteForceGuard = bruteForceGuard;
        this.lockoutPolicy = lockoutPolicy;
        this.rbacService = rbacService;
        this.events = events;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    @Transactional
    public RegisterResponse register(RegisterRequest request, DeviceMetadata device) {
        String email = normalizeEmail(request.email());
        if (userAccountRepository.existsByEmail(email)) {
            throw emailTaken();
        }
        passwordPolicy.assertAcceptable(request.password());

        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setPasswordHash(passwordHasher.hash(request.password()));
        user.setFirstName(trimToNull(request.firstName()));
        user.setLastName(trimToNull(request.lastName()));
        user.setPhone(trimToNull(request.phone()));
        user.setStatus(UserAccountStatus.ACTIVE);
        try {
            user = userAccountRepository.save(user);
            userAccountRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            log.info("Registration for an already registered email lost the insert race");
            throw emailTaken();
        }

        assignDefaultRole(user);
        IssuedToken verification = issueEmailVerificationToken(user);

        UUID userId = user.getId();
        String displayName = user.getDisplayName();
        events.securityEvent(SecurityEventTypes.REGISTRATION_SUCCESS, userId, device, payload("email", email));
        events.email("verification", mailer -> mailer.sendVerificationEmail(
                new AuthMailer.VerificationEmail(email, displayName, verification.token(), verification.expiresAt())));

        log.info("Registered user {}", userId);
        return new RegisterResponse(buildProfile(user), verification.expiresAt());
    }

    public LoginResponse login(LoginRequest request, DeviceMetadata device) {
        String email = normalizeEmail(request.email());
        Optional<UserAccount> found = userAccountRepository.findByEmailForUpdate(email);
        if (found.isEmpty()) {
            passwordHasher.verify(request.password(), null);
            BruteForceResult bruteForce = bruteForceGuard.recordFailure(email);
            events.securityEvent(SecurityEventTypes.LOGIN_FAILED, null, device,
                    payload("email", email, "reason", "unknown_email", "attempts", bruteForce.attempts()));
            recordCaptchaThreshold(null, email, bruteForce, device);
            throw invalidCredentials();
        }

        UserAccount user = found.get();
        if (lockoutPolicy.clearExpiredLockout(user)) {
            user = userAccountRepository.save(user);
            log.info("Lockout expired for user {}", user.getId());
        }

        if (!user.isActive()) {
            events.securityEvent(SecurityEventTypes.LOGIN_BLOCKED_INACTIVE, user.getId(), device,
                    payload("status", user.getStatus().name()));
            throw new UnauthorizedProblemException("account_inactive", "Account is not active. Please contact support.");
        }

        if (lockoutPolicy.isLocked(user)) {
            Map<String, Object> lockout = lockoutPolicy.lockoutDetails(user);
            events.securityEvent(SecurityEventTypes.LOGIN_BLOCKED_LOCKED, user.getId(), device,
                    payload("lockoutUntil", String.valueOf(user.getLockoutUntil())));
            throw new UnauthorizedProblemException(
                    "account_locked",
                    "Account is temporarily locked due to repeated failed login attempts. Try again in about "
                            + lockout.get("lockoutRemainingMinutes") + " minute(s).",
                    lockout);
        }

        if (!passwordHasher.verify(request.password(), user.getPasswordHash())) {
            handleFailedPassword(user, device);
            throw invalidCredentials();
        }

        lockoutPolicy.reset(user);
        user = userAccountRepository.save(user);
        bruteForceGuard.reset(email);

        IssuedSession issued = issueSession(user, device);
        UUID userId = user.getId();
        events.securityEvent(SecurityEventTypes.LOGIN_SUCCESS, userId, device,
                payload("sessionId", issued.sessionId().toString(), "newDevice", issued.newDevice()));
        if (issued.newDevice()) {
            String displayName = user.getDisplayName();
            DeviceMetadata source = device != null ? device : DeviceMetadata.unknown();
            OffsetDateTime loginAt = OffsetDateTime.now(clock);
            events.email("new-device", mailer -> mailer.sendNewDeviceLoginAlert(new AuthMailer.NewDeviceLoginEmail(
                    email, displayName, source.summary(), source.ipAddress(), source.userAgent(), loginAt)));
        }

        log.info("User {} logged in with session {}", userId, issued.sessionId());
        return new LoginResponse(buildProfile(user), issued.tokens(), issued.sessionId(), user.isEmailVerified());
    }

    public RefreshResponse refresh(RefreshRequest request, DeviceMetadata device) {
        VerifiedRefreshToken verified;
        try {
            verified = tokenService.verifyRefreshToken(request.refreshToken());
        } catch (TokenReuseDetectedException ex) {
            handleReplay(ex, device);
            throw ex;
        }

        assertFingerprintMatches(verified.session(), device);

        RotatedTokens rotated;
        try {
            rotated = tokenService.rotate(verified);
        } catch (TokenReuseDetectedException ex) {
            handleReplay(ex, device);
            throw ex;
        }

        UserAccount user = userAccountRepository.findById(rotated.userId())
                .orElseThrow(() -> new UnauthorizedProblemException("invalid_refresh_token", "Refresh token is invalid"));
        events.securityEvent(SecurityEventTypes.TOKEN_REFRESHED, user.getId(), device, payload(
                "sessionId", rotated.sessionId().toString(),
                "previousTokenId", rotated.previousTokenId(),
                "tokenId", rotated.refreshToken().payload().tokenId()));

        TokenPairResponse tokens = TokenPairResponse.of(rotated.accessToken(), rotated.refreshToken());
        return new RefreshResponse(buildProfile(user), tokens, rotated.sessionId());
    }

    public LogoutResponse logout(UUID sessionId, UUID userId) {
        tokenService.revokeToken(sessionId, RevocationReasons.MANUAL_LOGOUT);
        events.securityEvent(SecurityEventTypes.LOGOUT, userId, null, payload("sessionId", sessionId.toString()));
        return new LogoutResponse(true, sessionId);
    }

    public LogoutAllResponse logoutAll(UUID userId) {
        int revoked = sessionService.revokeAllUserSessions(userId, RevocationReasons.BULK_LOGOUT);
        events.securityEvent(SecurityEventTypes.LOGOUT_ALL, userId, null, payload("revokedCount", revoked));
        return new LogoutAllResponse(revoked);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse getProfile(UUID userId) {
        return buildProfile(loadUser(userId));
    }

    public AccountResponse verifyEmail(String token) {
        ParsedToken parsed = tokenCodec.parse(token);
        EmailVerificationToken record = emailVerificationTokenRepository.findById(parsed.id())
                .orElseThrow(() -> new ValidationProblemException("token_invalid",
                        "Verification token is invalid or has already been used."));
        assertUsable(record);

        UserAccount user = record.getUser();
        if (!tokenCodec.verifySecret(parsed.secret(), record.getTokenHash())) {
            int revoked = sessionService.revokeAllUserSessions(user.getId(), RevocationReasons.VERIFICATION_TOKEN_MISMATCH);
            log.warn("Verification token mismatch for user {}; revoked {} sessions", user.getId(), revoked);
            throw new UnauthorizedProblemException("token_mismatch", "Verification token is invalid.",
                    Map.of("revokedSessions", revoked));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (emailVerificationTokenRepository.consumeIfActive(record.getId(), now) == 0) {
            throw tokenConsumed();
        }
        record.consume(now);
        user.markEmailVerified(now);
        user = userAccountRepository.save(user);

        events.securityEvent(SecurityEventTypes.EMAIL_VERIFIED, user.getId(), null, payload("email", user.getEmail()));
        return new AccountResponse(true, buildProfile(user));
    }

    public VerificationResentResponse resendVerification(UUID userId) {
        UserAccount user = userAccountRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new NotFoundProblemException("user_not_found", "User not found."));
        if (user.isEmailVerified()) {
            throw new ConflictProblemException("email_already_verified", "Email address is already verified.");
        }

        emailVerificationTokenRepository.consumeActiveTokens(userId, OffsetDateTime.now(clock));
        IssuedToken verification = issueEmailVerificationToken(user);

        String email = user.getEmail();
        String displayName = user.getDisplayName();
        events.email("verification", mailer -> mailer.sendVerificationEmail(
                new AuthMailer.VerificationEmail(email, displayName, verification.token(), verification.expiresAt())));
        events.securityEvent(SecurityEventTypes.EMAIL_VERIFICATION_RESENT, userId, null, payload("email", email));
        return new VerificationResentResponse(true, verification.expiresAt());
    }

    public SuccessResponse requestPasswordReset(String rawEmail, DeviceMetadata device) {
        String email = normalizeEmail(rawEmail);
        Optional<UserAccount> found = userAccountRepository.findByEmailForUpdate(email);
        if (found.isEmpty()) {
            log.debug("Password reset requested for unknown email");
            return SuccessResponse.ok();
        }

        UserAccount user = found.get();
        DeviceMetadata source = device != null ? device : DeviceMetadata.unknown();
        OffsetDateTime now = OffsetDateTime.now(clock);
        passwordResetTokenRepository.consumeActiveTokens(user.getId(), now);

        HashedSecret secret = tokenCodec.generateHashedSecret();
        OffsetDateTime expiresAt = now.plus(authProperties.getTokens().getPasswordResetTtl());
        PasswordResetToken record = new PasswordResetToken();
        record.setUser(user);
        record.setTokenHash(secret.hash());
        record.setExpiresAt(expiresAt);
        record.setRequestedIp(source.ipAddress());
        record.setUserAgent(source.userAgent());
        record = passwordResetTokenRepository.save(record);
        String token = tokenCodec.serialise(record.getId(), secret.secret());

        String displayName = user.getDisplayName();
        events.email("password-reset", mailer -> mailer.sendPasswordResetEmail(
                new AuthMailer.PasswordResetEmail(email, displayName, token, expiresAt)));
        events.securityEvent(SecurityEventTypes.PASSWORD_RESET_REQUESTED, user.getId(), device,
                payload("expiresAt", expiresAt.toString()));
        return SuccessResponse.ok();
    }

    public AccountResponse resetPassword(ResetPasswordRequest request, DeviceMetadata device) {
        ParsedToken parsed = tokenCodec.parse(request.token());
        PasswordResetToken record = passwordResetTokenRepository.findById(parsed.id())
                .orElseThrow(() -> new ValidationProblemException("token_invalid",
                        "Password reset token is invalid or has already been used."));
        assertUsable(record);

        UserAccount user = record.getUser();
        if (!tokenCodec.verifySecret(parsed.secret(), record.getTokenHash())) {
            int revoked = sessionService.revokeAllUserSessions(user.getId(), RevocationReasons.PASSWORD_RESET_TOKEN_MISMATCH);
            log.warn("Password reset token mismatch for user {}; revoked {} sessions", user.getId(), revoked);
            throw new UnauthorizedProblemException("token_mismatch", "Password reset token is invalid.",
                    Map.of("revokedSessions", revoked));
        }
        passwordPolicy.assertAcceptable(request.password());

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (passwordResetTokenRepository.consumeIfActive(record.getId(), now) == 0) {
            throw tokenConsumed();
        }
        record.consume(now);
        user.setPasswordHash(passwordHasher.hash(request.password()));
        lockoutPolicy.reset(user);
        user = userAccountRepository.save(user);

        int revoked = sessionService.revokeAllUserSessions(user.getId(), RevocationReasons.PASSWORD_RESET);

        notifyPasswordChanged(user, now, device);
        events.securityEvent(SecurityEventTypes.PASSWORD_RESET_COMPLETED, user.getId(), device,
                payload("revokedSessions", revoked));
        return new AccountResponse(true, buildProfile(user));
    }

    public AccountResponse changePassword(UUID userId, UUID currentSessionId, ChangePasswordRequest request,
                                          DeviceMetadata device) {
        UserAccount user = loadUser(userId);
        if (!passwordHasher.verify(request.currentPassword(), user.getPasswordHash())) {
            throw new UnauthorizedProblemException("current_password_incorrect", "Current password is incorrect.");
        }
        passwordPolicy.assertAcceptable(request.newPassword());

        user.setPasswordHash(passwordHasher.hash(request.newPassword()));
        lockoutPolicy.reset(user);
        user = userAccountRepository.save(user);

        int revoked = sessionService.revokeAllUserSessions(userId, RevocationReasons.PASSWORD_CHANGE, currentSessionId);

        notifyPasswordChanged(user, OffsetDateTime.now(clock), device);
        events.securityEvent(SecurityEventTypes.PASSWORD_CHANGED, userId, device,
                payload("revokedSessions", revoked,
                        "keptSessionId", currentSessionId != null ? currentSessionId.toString() : null));
        return new AccountResponse(true, buildProfile(user));
    }

    public UserProfileResponse unlockAccount(UUID userId, UUID actorId, String reason) {
        UserAccount user = loadUser(userId);
        lockoutPolicy.reset(user);
        user.setStatus(UserAccountStatus.ACTIVE);
        user = userAccountRepository.save(user);
        bruteForceGuard.reset(user.getEmail());

        events.securityEvent(SecurityEventTypes.ACCOUNT_UNLOCK_MANUAL, userId, null, payload(
                "actorId", actorId != null ? actorId.toString() : null,
                "reason", trimToNull(reason)));
        log.info("Account {} unlocked by {}", userId, actorId);
        return buildProfile(user);
    }

    private void handleFailedPassword(UserAccount user, DeviceMetadata device) {
        FailureOutcome outcome = lockoutPolicy.registerFailure(user);
        userAccountRepository.save(user);
        BruteForceResult bruteForce = bruteForceGuard.recordFailure(user.getEmail());

        UUID userId = user.getId();
        events.securityEvent(SecurityEventCommand.of(
                SecurityEventTypes.LOGIN_FAILED,
                userId,
                device != null ? device.ipAddress() : null,
                device != null ? device.userAgent() : null,
                payload("reason", "invalid_password",
                        "failedAttempts", outcome.failedAttempts(),
                        "locked", outcome.locked())
        ).withSeverity(outcome.locked() ? SecurityEventSeverity.WARNING : SecurityEventSeverity.INFO));
        recordCaptchaThreshold(userId, user.getEmail(), bruteForce, device);

        if (outcome.locked()) {
            String email = user.getEmail();
            String displayName = user.getDisplayName();
            events.securityEvent(SecurityEventTypes.ACCOUNT_LOCKED, userId, device, payload(
                    "failedAttempts", outcome.failedAttempts(),
                    "lockoutUntil", outcome.lockoutUntil().toString()));
            events.email("account-lockout", mailer -> mailer.sendAccountLockoutNotification(
                    new AuthMailer.AccountLockoutEmail(email, displayName, outcome.lockoutUntil(),
                            outcome.failedAttempts())));
            log.warn("User {} locked until {} after {} failed attempts", userId, outcome.lockoutUntil(),
                    outcome.failedAttempts());
        }
    }

    private void recordCaptchaThreshold(UUID userId, String email, BruteForceResult bruteForce, DeviceMetadata device) {
        if (bruteForce.captchaRequired()) {
            events.securityEvent(SecurityEventTypes.LOGIN_CAPTCHA_THRESHOLD, userId, device,
                    payload("email", email, "attempts", bruteForce.attempts()));
        }
    }

    private void assertFingerprintMatches(UserSession session, DeviceMetadata device) {
        String stored = session.getFingerprint();
        if (stored == null) {
            return;
        }
        String presented = deviceFingerprintService.fingerprint(device);
        if (!deviceFingerprintService.matches(stored, presented)) {
            sessionService.handleFingerprintMismatch(session, device);
            throw new UnauthorizedProblemException("session_fingerprint_mismatch",
                    "Authentication session fingerprint mismatch detected.");
        }
    }

    private void handleReplay(TokenReuseDetectedException ex, DeviceMetadata device) {
        Optional<UserAccount> user = userAccountRepository.findById(ex.getUserId());
        DeviceMetadata source = device != null ? device : DeviceMetadata.unknown();
        user.ifPresent(account -> {
            String email = account.getEmail();
            String displayName = account.getDisplayName();
            Map<String, Object> metadata = payload(
                    "sessionId", ex.getSessionId().toString(),
                    "revokedSessions", ex.getRevokedCount(),
                    "ipAddress", source.ipAddress(),
                    "userAgent", source.userAgent());
            events.email("security-alert", mailer -> mailer.sendSecurityAlertEmail(
                    new AuthMailer.SecurityAlertEmail(email, displayName, "refresh_token_replay", metadata)));
        });
        events.securityEvent(SecurityEventTypes.REFRESH_TOKEN_REPLAY_DETECTED, ex.getUserId(), device, payload(
                "sessionId", ex.getSessionId().toString(),
                "revokedSessions", ex.getRevokedCount(),
                "userNotified", user.isPresent()));
    }

    private void notifyPasswordChanged(UserAccount user, OffsetDateTime changedAt, DeviceMetadata device) {
        String email = user.getEmail();
        String displayName = user.getDisplayName();
        String ipAddress = device != null ? device.ipAddress() : null;
        events.email("password-changed", mailer -> mailer.sendPasswordChangedNotification(
                new AuthMailer.PasswordChangedEmail(email, displayName, changedAt, ipAddress)));
    }

    private IssuedSession issueSession(UserAccount user, DeviceMetadata device) {
        UUID sessionId = UUID.randomUUID();
        String fingerprint = deviceFingerprintService.fingerprint(device);
        boolean newDevice = fingerprint != null
                && sessionService.findSessionsByFingerprint(user.getId(), fingerprint).isEmpty();

        IssuedRefreshToken refresh = tokenService.generateRefreshToken(user, sessionId);
        sessionService.createSession(new NewSession(
                sessionId,
                user.getId(),
                refresh.secretHash(),
                refresh.token().payload().tokenId(),
                refresh.token().expiresAt(),
                device
        ));
        GeneratedToken<AccessTokenClaims> access = tokenService.generateAccessToken(user, sessionId);
        return new IssuedSession(sessionId, TokenPairResponse.of(access, refresh.token()), newDevice);
    }

    private IssuedToken issueEmailVerificationToken(UserAccount user) {
        HashedSecret secret = tokenCodec.generateHashedSecret();
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(authProperties.getTokens().getEmailVerificationTtl());
        EmailVerificationToken record = new EmailVerificationToken();
        record.setUser(user);
        record.setTokenHash(secret.hash());
        record.setExpiresAt(expiresAt);
        record = emailVerificationTokenRepository.save(record);
        return new IssuedToken(tokenCodec.serialise(record.getId(), secret.secret()), expiresAt);
    }

    private void assertUsable(AbstractSingleUseToken token) {
        if (token.isConsumed()) {
            throw tokenConsumed();
        }
        if (token.isExpiredAt(OffsetDateTime.now(clock))) {
            throw new ValidationProblemException("token_expired", "Token has expired.");
        }
    }

    private void assignDefaultRole(UserAccount user) {
        roleRepository.findById(DEFAULT_ROLE_CODE).ifPresentOrElse(role -> {
            UserRole userRole = new UserRole();
            userRole.setUser(user);
            userRole.setRole(role);
            userRole.setGrantedAt(OffsetDateTime.now(clock));
            userRoleRepository.save(userRole);
        }, () -> log.warn("Default role {} not found; user {} registered without roles", DEFAULT_ROLE_CODE, user.getId()));
    }

    private UserAccount loadUser(UUID userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new NotFoundProblemException("user_not_found", "User not found."));
    }

    private UserProfileResponse buildProfile(UserAccount user) {
        List<String> roles = rbacService.getUserRoleCodes(user.getId());
        List<String> permissions = rbacService.getUserPermissions(user.getId());
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getPhone(),
                user.isEmailVerified(),
                user.getStatus().name(),
                roles,
                permissions,
                roles.contains(ADMIN_ROLE_CODE),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    private static ConflictProblemException emailTaken() {
        return new ConflictProblemException("email_taken", "An account with this email already exists.");
    }

    private static ValidationProblemException tokenConsumed() {
        return new ValidationProblemException("token_consumed", "Token has already been used.");
    }

    private static UnauthorizedProblemException invalidCredentials() {
        return new UnauthorizedProblemException("invalid_credentials", INVALID_CREDENTIALS_MESSAGE);
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new ValidationProblemException("validation_error", "Email is required.");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private record IssuedSession(UUID sessionId, TokenPairResponse tokens, boolean newDevice) {
    }

    private record IssuedToken(String token, OffsetDateTime expiresAt) {
    }
}
