package com.lumi.backend.modules.notification.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Default mailer: renders the action links against the frontend and logs the message instead of
 * sending it. Replace with an SMTP or provider-backed bean in deployments that deliver mail.
 */
@Component
public class LoggingAuthMailer implements AuthMailer {

    private static final Logger log = LoggerFactory.getLogger(LoggingAuthMailer.class);

    private final String frontendUrl;

    public LoggingAuthMailer(@Value("${lumi.app.frontend-url:http://localhost:5173}") String frontendUrl) {
        this.frontendUrl = frontendUrl;
    }

    @Override
    public void sendVerificationEmail(VerificationEmail email) {
        String link = link("/verify-email", email.token());
        log.info("Queued verification email to {} (expires {}): {}", email.to(), email.expiresAt(), link);
    }

    @Override
    public void sendPasswordResetEmail(PasswordResetEmail email) {
        String link = link("/reset-password", email.token());
        log.info("Queued password reset email to {} (expires {}): {}", email.to(), email.expiresAt(), link);
    }

    @Override
    public void sendPasswordChangedNotification(PasswordChangedEmail email) {
        log.info("Queued password changed notice to {} (changed {} from {})", email.to(), email.changedAt(),
                email.ipAddress());
    }

    @Override
    public void sendAccountLockoutNotification(AccountLockoutEmail email) {
        log.info("Queued account lockout notice to {} after {} failed attempts (unlocks {})", email.to(),
                email.failedAttempts(), email.unlockAt());
    }

    @Override
    public void sendNewDeviceLoginAlert(NewDeviceLoginEmail email) {
        log.info("Queued new device alert to {}: {} at {}", email.to(), email.deviceSummary(), email.loginAt());
    }

    @Override
    public void sendSecurityAlertEmail(SecurityAlertEmail email) {
        log.info("Queued security alert '{}' to {} {}", email.category(), email.to(), email.metadata());
    }

    String link(String path, String token) {
        return UriComponentsBuilder.fromHttpUrl(frontendUrl)
                .path(path)
                .queryParam("token", token)
                .build()
                .encode()
                .toUriString();
    }
}
