package com.lumi.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lumi.backend.modules.auth.domain.DeviceMetadata;
import com.lumi.backend.modules.auth.domain.UserSession;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session store. Revocations are conditional updates, so revoking twice (or concurrently) is
 * harmless. Every revocation and fingerprint mismatch is published as an application event.
 */
@Service
@Transactional
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private static final int USER_AGENT_MAX_LENGTH = 512;
    private static final int IP_ADDRESS_MAX_LENGTH = 64;

    private final UserSessionRepository userSessionRepository;
    private final UserAccountRepository userAccountRepository;
    private final DeviceFingerprintService deviceFingerprintService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public SessionService(
            UserSessionRepository userSessionRepository,
            UserAccountRepository userAccountRepository,
            DeviceFingerprintService deviceFingerprintService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.userSessionRepository = userSessionRepository;
        this.userAccountRepository = userAccountRepository;
        this.deviceFingerprintService = deviceFingerprintService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public UserSession createSession(NewSession command) {
        DeviceMetadata device = command.device() != null ? command.device() : DeviceMetadata.unknown();
        OffsetDateTime now = OffsetDateTime.now(clock);

        UserSession session = new UserSession(command.sessionId());
        session.setUser(userAccountRepository.getReferenceById(command.userId()));
        session.setRefreshTokenHash(command.refreshTokenHash());
        session.setRefreshTokenId(command.refreshTokenId());
        session.setLastRotatedAt(now);
        session.setExpiresAt(command.expiresAt());
        session.setFingerprint(deviceFingerprintService.fingerprint(device));
        session.setIpAddress(truncate(device.ipAddress(), IP_ADDRESS_MAX_LENGTH));
        session.setUserAgent(truncate(device.userAgent(), USER_AGENT_MAX_LENGTH));

        UserSession saved = userSessionRepository.save(session);
        log.info("Session {} created for user {}", command.sessionId(), command.userId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> findSession(UUID sessionId) {
        return userSessionRepository.findById(sessionId);
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> findActiveSession(UUID sessionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userSessionRepository.findById(sessionId)
                .filter(session -> session.isActiveAt(now));
    }

    @Transactional(readOnly = true)
    public List<UserSession> findSessionsByFingerprint(UUID userId, String fingerprint) {
        if (fingerprint == null) {
            return List.of();
        }
        return userSessionRepository.findByUserIdAndFingerprint(userId, fingerprint);
    }

    /**
     * @return {@code true} if this call revoked the session, {@code false} if it was unknown or
     * already revoked
     */
    public boolean revokeSession(UUID sessionId, String reason) {
        Optional<UserSession> session = userSessionRepository.findById(sessionId);
        if (session.isEmpty()) {
            log.warn("Attempted to revoke unknown session {} ({})", sessionId, reason);
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = userSessionRepository.revokeIfActive(sessionId, now, reason);
        if (updated == 0) {
            log.debug("Session {} already revoked", sessionId);
            return false;
        }
        UUID userId = session.get().getUserId();
        log.info("Session {} of user {} revoked ({})", sessionId, userId, reason);
        eventPublisher.publishEvent(new SessionRevokedEvent(userId, List.of(sessionId), reason, now));
        return true;
    }

    public int revokeAllUserSessions(UUID userId, String reason) {
        return revokeSessions(userId, userSessionRepository.findUnrevokedSessionIds(userId), reason);
    }

    public int revokeAllUserSessions(UUID userId, String reason, UUID exceptSessionId) {
        if (exceptSessionId == null) {
            return revokeAllUserSessions(userId, reason);
        }
        return revokeSessions(userId, userSessionRepository.findUnrevokedSessionIdsExcept(userId, exceptSessionId), reason);
    }

    /**
     * Compare-and-set on the refresh generation. Returns {@code false} when another rotation or a
     * revocation already changed the session.
     */
    public boolean rotateRefreshToken(UUID sessionId, String expectedTokenId, String newHash, String newTokenId,
                                      OffsetDateTime newExpiresAt) {
        int updated = userSessionRepository.rotateRefreshToken(
                sessionId, expectedTokenId, newHash, newTokenId, newExpiresAt, OffsetDateTime.now(clock));
        if (updated == 0) {
            log.warn("Refresh rotation lost for session {} (expected generation {})", sessionId, expectedTokenId);
            return false;
        }
        return true;
    }

    public void handleFingerprintMismatch(UserSession session, DeviceMetadata device) {
        DeviceMetadata presented = device != null ? device : DeviceMetadata.unknown();
        log.warn("Fingerprint mismatch on session {} of user {} from {}", session.getId(), session.getUserId(),
                presented.summary());
        revokeSession(session.getId(), RevocationReasons.FINGERPRINT_MISMATCH);
        eventPublisher.publishEvent(new SessionFingerprintMismatchEvent(
                session.getUserId(),
                session.getId(),
                presented.ipAddress(),
                presented.userAgent(),
                OffsetDateTime.now(clock)
        ));
    }

    public int revokeExpiredSessions() {
        int revoked = userSessionRepository.revokeExpiredSessions(OffsetDateTime.now(clock), RevocationReasons.EXPIRED);
        if (revoked > 0) {
            log.info("Revoked {} expired sessions", revoked);
        }
        return revoked;
    }

    private int revokeSessions(UUID userId, List<UUID> sessionIds, String reason) {
        if (sessionIds.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked = userSessionRepository.revokeAllIfActive(sessionIds, now, reason);
        if (revoked > 0) {
            log.info("Revoked {} sessions of user {} ({})", revoked, userId, reason);
            eventPublisher.publishEvent(new SessionRevokedEvent(userId, List.copyOf(sessionIds), reason, now));
        }
        return revoked;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }

    public record NewSession(
            UUID sessionId,
            UUID userId,
            String refreshTokenHash,
            String refreshTokenId,
            OffsetDateTime expiresAt,
            DeviceMetadata device
    ) {
    }
}
