package com.lumi.backend.global.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables for the authentication core, bound from {@code lumi.auth.*}.
 */
@Validated
@ConfigurationProperties(prefix = "lumi.auth")
public class AuthProperties {

    @Valid
    private final Lockout lockout = new Lockout();

    @Valid
    private final BruteForce bruteForce = new BruteForce();

    @Valid
    private final Tokens tokens = new Tokens();

    @Valid
    private final Session session = new Session();

    @Valid
    private final Password password = new Password();

    public Lockout getLockout() {
        return lockout;
    }

    public BruteForce getBruteForce() {
        return bruteForce;
    }

    public Tokens getTokens() {
        return tokens;
    }

    public Session getSession() {
        return session;
    }

    public Password getPassword() {
        return password;
    }

    public static class Lockout {

        @Min(3)
        private int maxLoginAttempts = 5;

        @NotNull
        private Duration duration = Duration.ofMinutes(15);

        public int getMaxLoginAttempts() {
            return maxLoginAttempts;
        }

        public void setMaxLoginAttempts(int maxLoginAttempts) {
            this.maxLoginAttempts = maxLoginAttempts;
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }
    }

    public static class BruteForce {

        private boolean enabled = true;

        /** {@code memory} or {@code redis}. */
        @NotBlank
        private String store = "memory";

        @NotNull
        private Duration window = Duration.ofMinutes(15);

        @Min(1)
        private int captchaThreshold = 3;

        /** Upper bound on keys the in-memory store tracks at once. */
        @Min(1)
        private long maxTrackedKeys = 100_000;

        @Valid
        private final ProgressiveDelays progressiveDelays = new ProgressiveDelays();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getCaptchaThreshold() {
            return captchaThreshold;
        }

        public void setCaptchaThreshold(int captchaThreshold) {
            this.captchaThreshold = captchaThreshold;
        }

        public long getMaxTrackedKeys() {
            return maxTrackedKeys;
        }

        public void setMaxTrackedKeys(long maxTrackedKeys) {
            this.maxTrackedKeys = maxTrackedKeys;
        }

        public ProgressiveDelays getProgressiveDelays() {
            return progressiveDelays;
        }
    }

    public static class ProgressiveDelays {

        @NotNull
        private Duration base = Duration.ofMillis(250);

        @NotNull
        private Duration step = Duration.ofMillis(250);

        @NotNull
        private Duration max = Duration.ofSeconds(5);

        public Duration getBase() {
            return base;
        }

        public void setBase(Duration base) {
            this.base = base;
        }

        public Duration getStep() {
            return step;
        }

        public void setStep(Duration step) {
            this.step = step;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }
    }

    public static class Tokens {

        @NotNull
        private Duration emailVerificationTtl = Duration.ofHours(24);

        @NotNull
        private Duration passwordResetTtl = Duration.ofHours(1);

        public Duration getEmailVerificationTtl() {
            return emailVerificationTtl;
        }

        public void setEmailVerificationTtl(Duration emailVerificationTtl) {
            this.emailVerificationTtl = emailVerificationTtl;
        }

        public Duration getPasswordResetTtl() {
            return passwordResetTtl;
        }

        public void setPasswordResetTtl(Duration passwordResetTtl) {
            this.passwordResetTtl = passwordResetTtl;
        }
    }

    public static class Session {

        @NotBlank
        @Size(min = 32, message = "fingerprint secret must be at least 32 characters")
        private String fingerprintSecret;

        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(5);

        public String getFingerprintSecret() {
            return fingerprintSecret;
        }

        public void setFingerprintSecret(String fingerprintSecret) {
            this.fingerprintSecret = fingerprintSecret;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }

    public static class Password {

        @Min(4)
        @Max(31)
        private int bcryptStrength = 12;

        @Min(8)
        private int minLength = 8;

        private boolean requireUppercase = true;
        private boolean requireLowercase = true;
        private boolean requireDigit = true;
        private boolean requireSpecial = true;

        public int getBcryptStrength() {
            return bcryptStrength;
        }

        public void setBcryptStrength(int bcryptStrength) {
            this.bcryptStrength = bcryptStrength;
        }

        public int getMinLength() {
            return minLength;
        }

        public void setMinLength(int minLength) {
            this.minLength = minLength;
        }

        public boolean isRequireUppercase() {
            return requireUppercase;
        }

        public void setRequireUppercase(boolean requireUppercase) {
            this.requireUppercase = requireUppercase;
        }

        public boolean isRequireLowercase() {
            return requireLowercase;
        }

        public void setRequireLowercase(boolean requireLowercase) {
            this.requireLowercase = requireLowercase;
        }

        public boolean isRequireDigit() {
            return requireDigit;
        }

        public void setRequireDigit(boolean requireDigit) {
            this.requireDigit = requireDigit;
        }

        public boolean isRequireSpecial() {
            return requireSpecial;
        }

        public void setRequireSpecial(boolean requireSpecial) {
            this.requireSpecial = requireSpecial;
        }
    }
}
