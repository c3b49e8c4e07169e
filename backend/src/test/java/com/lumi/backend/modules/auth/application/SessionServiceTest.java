package com.lumi.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lumi.backend.global.config.AuthProperties;
import com.lumi.backend.modules.auth.application.SessionService.NewSession;
import com.lumi.backend.modules.auth.domain.DeviceMetadata;
import com.lumi.backend.modules.auth.domain.UserAccount;
import com.lumi.backend.modules.auth.domain.UserSession;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.lumi.backend.support.MutableClock;
import com.lumi.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private UserSessionRepository userSessionRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private DeviceFingerprintService fingerprintService;
    private SessionService sessionService;
    private UserAccount user;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        AuthProperties properties = new AuthProperties();
        properties.getSession().setFingerprintSecret("test-fingerprint-secret-0123456789abcdef");
        fingerprintService = new DeviceFingerprintService(properties);
        sessionService = new SessionService(userSessionRepository, userAccountRepository, fingerprintService,
                eventPublisher, clock);
        user = TestEntities.user(USER_ID, "jamie@example.com", "hash");
    }

    @Test
    void createSessionStoresFingerprintAndTrimmedDeviceData() {
        UUID sessionId = UUID.randomUUID();
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plusDays(7);
        DeviceMetadata device = new DeviceMetadata(" 203.0.113.7 ", "x".repeat(600));
        when(userAccountRepository.getReferenceById(USER_ID)).thenReturn(user);
        when(userSessionRepository.save(any(UserSession.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserSession session = sessionService.createSession(
                new NewSession(sessionId, USER_ID, "hash-1", "gen-1", expiresAt, device));

        assertThat(session.getId()).isEqualTo(sessionId);
        assertThat(session.getUserId()).isEqualTo(USER_ID);
        assertThat(session.getRefreshTokenHash()).isEqualTo("hash-1");
        assertThat(session.getRefreshTokenId()).isEqualTo("gen-1");
        assertThat(session.getLastRotatedAt()).isEqualTo(OffsetDateTime.now(clock));
        assertThat(session.getExpiresAt()).isEqualTo(expiresAt);
        assertThat(session.getFingerprint()).isEqualTo(fingerprintService.fingerprint(device));
        assertThat(session.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(session.getUserAgent()).hasSize(512);
    }

    @Test
    void createSessionWithoutDeviceHasNoFingerprint() {
        when(userAccountRepository.getReferenceById(USER_ID)).thenReturn(user);
        when(userSessionRepository.save(any(UserSession.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserSession session = sessionService.createSession(new NewSession(UUID.randomUUID(), USER_ID, "h", "g",
                OffsetDateTime.now(clock).plusDays(1), null));

        assertThat(session.getFingerprint()).isNull();
        assertThat(session.getIpAddress()).isNull();
    }

    @Test
    void revokeSessionPublishesEventOnlyWhenItChangedSomething() {
        UUID sessionId = UUID.randomUUID();
        UserSession session = TestEntities.session(sessionId, user, "h", "g", OffsetDateTime.now(clock).plusDays(1));
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.of(session));
        when(userSessionRepository.revokeIfActive(eq(sessionId), any(), eq(RevocationReasons.MANUAL_LOGOUT)))
                .thenReturn(1)
                .thenReturn(0);

        assertThat(sessionService.revokeSession(sessionId, RevocationReasons.MANUAL_LOGOUT)).isTrue();
        assertThat(sessionService.revokeSession(sessionId, RevocationReasons.MANUAL_LOGOUT)).isFalse();

        ArgumentCaptor<SessionRevokedEvent> captor = ArgumentCaptor.forClass(SessionRevokedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().sessionIds()).containsExactly(sessionId);
        assertThat(captor.getValue().reason()).isEqualTo(RevocationReasons.MANUAL_LOGOUT);
        assertThat(captor.getValue().userId()).isEqualTo(USER_ID);
    }

    @Test
    void revokingUnknownSessionIsANoOp() {
        UUID sessionId = UUID.randomUUID();
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.empty());

        assertThat(sessionService.revokeSession(sessionId, RevocationReasons.MANUAL_LOGOUT)).isFalse();

        verify(userSessionRepository, never()).revokeIfActive(any(), any(), anyString());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void revokeAllUserSessionsCanKeepTheCurrentOne() {
        UUID current = UUID.randomUUID();
        List<UUID> others = List.of(UUID.randomUUID(), UUID.randomUUID());
        when(userSessionRepository.findUnrevokedSessionIdsExcept(USER_ID, current)).thenReturn(others);
        when(userSessionRepository.revokeAllIfActive(eq(others), any(), eq(RevocationReasons.PASSWORD_CHANGE)))
                .thenReturn(2);

        int revoked = sessionService.revokeAllUserSessions(USER_ID, RevocationReasons.PASSWORD_CHANGE, current);

        assertThat(revoked).isEqualTo(2);
        verify(userSessionRepository, never()).findUnrevokedSessionIds(any());
        verify(eventPublisher).publishEvent(any(SessionRevokedEvent.class));
    }

    @Test
    void revokeAllWithNothingActiveSkipsTheUpdate() {
        when(userSessionRepository.findUnrevokedSessionIds(USER_ID)).thenReturn(List.of());

        assertThat(sessionService.revokeAllUserSessions(USER_ID, RevocationReasons.BULK_LOGOUT)).isZero();

        verify(userSessionRepository, never()).revokeAllIfActive(any(), any(), anyString());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void rotateRefreshTokenReportsLostCompareAndSet() {
        UUID sessionId = UUID.randomUUID();
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plusDays(7);
        when(userSessionRepository.rotateRefreshToken(sessionId, "gen-1", "hash-2", "gen-2", expiresAt,
                OffsetDateTime.now(clock)))
                .thenReturn(1)
                .thenReturn(0);

        assertThat(sessionService.rotateRefreshToken(sessionId, "gen-1", "hash-2", "gen-2", expiresAt)).isTrue();
        assertThat(sessionService.rotateRefreshToken(sessionId, "gen-1", "hash-2", "gen-2", expiresAt)).isFalse();
    }

    @Test
    void fingerprintMismatchRevokesAndPublishesMismatchEvent() {
        UUID sessionId = UUID.randomUUID();
        UserSession session = TestEntities.session(sessionId, user, "h", "g", OffsetDateTime.now(clock).plusDays(1));
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.of(session));
        when(userSessionRepository.revokeIfActive(eq(sessionId), any(), eq(RevocationReasons.FINGERPRINT_MISMATCH)))
                .thenReturn(1);

        sessionService.handleFingerprintMismatch(session, new DeviceMetadata("198.51.100.2", "curl/8.0"));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(captor.capture());
        assertThat(captor.getAllValues()).hasExactlyElementsOfTypes(
                SessionRevokedEvent.class, SessionFingerprintMismatchEvent.class);
        SessionFingerprintMismatchEvent mismatch = (SessionFingerprintMismatchEvent) captor.getAllValues().get(1);
        assertThat(mismatch.ipAddress()).isEqualTo("198.51.100.2");
        assertThat(mismatch.sessionId()).isEqualTo(sessionId);
    }

    @Test
    void findActiveSessionFiltersExpiredAndRevoked() {
        UUID live = UUID.randomUUID();
        UUID expired = UUID.randomUUID();
        UUID revoked = UUID.randomUUID();
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession revokedSession = TestEntities.session(revoked, user, "h", "g", now.plusDays(1));
        revokedSession.revoke(now, RevocationReasons.MANUAL_LOGOUT);
        when(userSessionRepository.findById(live))
                .thenReturn(Optional.of(TestEntities.session(live, user, "h", "g", now.plusDays(1))));
        when(userSessionRepository.findById(expired))
                .thenReturn(Optional.of(TestEntities.session(expired, user, "h", "g", now)));
        when(userSessionRepository.findById(revoked)).thenReturn(Optional.of(revokedSession));

        assertThat(sessionService.findActiveSession(live)).isPresent();
        assertThat(sessionService.findActiveSession(expired)).isEmpty();
        assertThat(sessionService.findActiveSession(revoked)).isEmpty();
    }

    @Test
    void revokeExpiredSessionsUsesExpiredReason() {
        when(userSessionRepository.revokeExpiredSessions(OffsetDateTime.now(clock), RevocationReasons.EXPIRED))
                .thenReturn(3);

        assertThat(sessionService.revokeExpiredSessions()).isEqualTo(3);
    }
}
