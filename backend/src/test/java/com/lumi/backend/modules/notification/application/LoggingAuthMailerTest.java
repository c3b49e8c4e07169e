package com.lumi.backend.modules.notification.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.time.OffsetDateTime;
import java.util.Map;

import org.junit.jupiter.api.Test;

class LoggingAuthMailerTest {

    private final LoggingAuthMailer mailer = new LoggingAuthMailer("https://app.example.com");

    @Test
    void linksPointAtFrontendWithEncodedToken() {
        String link = mailer.link("/verify-email", "5f0c.abc-_XYZ");

        assertThat(link).isEqualTo("https://app.example.com/verify-email?token=5f0c.abc-_XYZ");
    }

    @Test
    void everyMessageTypeCanBeSent() {
        OffsetDateTime now = OffsetDateTime.parse("2025-03-01T10:00:00Z");

        assertThatCode(() -> {
            mailer.sendVerificationEmail(new AuthMailer.VerificationEmail("a@example.com", "A", "t.s", now));
            mailer.sendPasswordResetEmail(new AuthMailer.PasswordResetEmail("a@example.com", "A", "t.s", now));
            mailer.sendPasswordChangedNotification(new AuthMailer.PasswordChangedEmail("a@example.com", "A", now, null));
            mailer.sendAccountLockoutNotification(new AuthMailer.AccountLockoutEmail("a@example.com", "A", now, 5));
            mailer.sendNewDeviceLoginAlert(new AuthMailer.NewDeviceLoginEmail("a@example.com", "A", "Firefox",
                    "203.0.113.7", "Firefox", now));
            mailer.sendSecurityAlertEmail(new AuthMailer.SecurityAlertEmail("a@example.com", "A",
                    "refresh_token_replay", Map.of("revokedSessions", 2)));
        }).doesNotThrowAnyException();
    }
}
