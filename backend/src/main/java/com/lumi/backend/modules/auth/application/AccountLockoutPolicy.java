package com.lumi.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import com.lumi.backend.global.common.FieldUpdate;
import com.lumi.backend.global.config.AuthProperties;
import com.lumi.backend.modules.auth.domain.UserAccount;

import org.springframework.stereotype.Component;

/**
 * Durable lockout stored on the account: {@code maxLoginAttempts} consecutive wrong passwords
 * lock the account for {@code duration}. An elapsed lock is cleared lazily on the next attempt.
 */
@Component
public class AccountLockoutPolicy {

    private final AuthProperties.Lockout config;
    private final Clock clock;

    public AccountLockoutPolicy(AuthProperties authProperties, Clock clock) {
        this.config = authProperties.getLockout();
        this.clock = clock;
    }

    /**
     * @return {@code true} if an elapsed lock was cleared and the account needs saving
     */
    public boolean clearExpiredLockout(UserAccount account) {
        OffsetDateTime lockoutUntil = account.getLockoutUntil();
        if (lockoutUntil != null && !OffsetDateTime.now(clock).isBefore(lockoutUntil)) {
            account.applyLockoutState(0, FieldUpdate.clear());
            return true;
        }
        return false;
    }

    public boolean isLocked(UserAccount account) {
        return remainingSeconds(account) > 0;
    }

    public long remainingSeconds(UserAccount account) {
        OffsetDateTime lockoutUntil = account.getLockoutUntil();
        if (lockoutUntil == null) {
            return 0;
        }
        Duration remaining = Duration.between(OffsetDateTime.now(clock), lockoutUntil);
        if (remaining.isNegative() || remaining.isZero()) {
            return 0;
        }
        long seconds = remaining.getSeconds();
        return remaining.getNano() > 0 ? seconds + 1 : seconds;
    }

    public static long remainingMinutes(long remainingSeconds) {
        if (remainingSeconds <= 0) {
            return 0;
        }
        return Math.max(1, (remainingSeconds + 59) / 60);
    }

    public FailureOutcome registerFailure(UserAccount account) {
        int attempts = account.getFailedLoginCount() + 1;
        boolean locked = attempts >= config.getMaxLoginAttempts();
        FieldUpdate<OffsetDateTime> lockoutUpdate = locked
                ? FieldUpdate.setTo(OffsetDateTime.now(clock).plus(config.getDuration()))
                : FieldUpdate.keep();
        account.applyLockoutState(attempts, lockoutUpdate);
        return new FailureOutcome(attempts, locked, account.getLockoutUntil());
    }

    public void reset(UserAccount account) {
        account.applyLockoutState(0, FieldUpdate.clear());
    }

    public Map<String, Object> lockoutDetails(UserAccount account) {
        long seconds = remainingSeconds(account);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lockoutUntil", account.getLockoutUntil());
        details.put("lockoutRemainingSeconds", seconds);
        details.put("lockoutRemainingMinutes", remainingMinutes(seconds));
        return details;
    }

    public record FailureOutcome(int failedAttempts, boolean locked, OffsetDateTime lockoutUntil) {
    }
}
