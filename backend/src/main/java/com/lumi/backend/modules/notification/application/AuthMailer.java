package com.lumi.backend.modules.notification.application;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Outbound account emails. Implementations may throw; callers dispatch them in the background and
 * only log failures.
 */
public interface AuthMailer {

    void sendVerificationEmail(VerificationEmail email);

    void sendPasswordResetEmail(PasswordResetEmail email);

    void sendPasswordChangedNotification(PasswordChangedEmail email);

    void sendAccountLockoutNotification(AccountLockoutEmail email);

    void sendNewDeviceLoginAlert(NewDeviceLoginEmail email);

    void sendSecurityAlertEmail(SecurityAlertEmail email);

    record VerificationEmail(String to, String displayName, String token, OffsetDateTime expiresAt) {
    }

    record PasswordResetEmail(String to, String displayName, String token, OffsetDateTime expiresAt) {
    }

    record PasswordChangedEmail(String to, String displayName, OffsetDateTime changedAt, String ipAddress) {
    }

    record AccountLockoutEmail(String to, String displayName, OffsetDateTime unlockAt, int failedAttempts) {
    }

    record NewDeviceLoginEmail(String to, String displayName, String deviceSummary, String ipAddress,
                               String userAgent, OffsetDateTime loginAt) {
    }

    record SecurityAlertEmail(String to, String displayName, String category, Map<String, Object> metadata) {
    }
}
