package com.lumi.backend.support;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lumi.backend.modules.auth.domain.AbstractSingleUseToken;
import com.lumi.backend.modules.auth.domain.UserAccount;
import com.lumi.backend.modules.auth.domain.UserAccountStatus;
import com.lumi.backend.modules.auth.domain.UserSession;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Builds detached entities with ids already assigned, for service tests that mock repositories.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static UserAccount user(UUID id, String email, String passwordHash) {
        UserAccount user = new UserAccount();
        ReflectionTestUtils.setField(user, "id", id);
        user.setEmail(email);
        user.setPasswordHash(passwordHash);
        user.setFirstName("Jamie");
        user.setStatus(UserAccountStatus.ACTIVE);
        return user;
    }

    public static UserSession session(UUID id, UserAccount user, String refreshTokenHash, String refreshTokenId,
                                      OffsetDateTime expiresAt) {
        UserSession session = new UserSession(id);
        session.setUser(user);
        session.setRefreshTokenHash(refreshTokenHash);
        session.setRefreshTokenId(refreshTokenId);
        session.setLastRotatedAt(expiresAt.minusDays(7));
        session.setExpiresAt(expiresAt);
        return session;
    }

    public static <T extends AbstractSingleUseToken> T withId(T token, UUID id) {
        ReflectionTestUtils.setField(token, "id", id);
        return token;
    }
}
