package com.lumi.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.lumi.backend.modules.audit.application.SecurityEventService.SecurityEventCommand;
import com.lumi.backend.modules.audit.domain.SecurityEvent;
import com.lumi.backend.modules.audit.domain.SecurityEventSeverity;
import com.lumi.backend.modules.audit.domain.SecurityEventTypes;
import com.lumi.backend.modules.audit.infrastructure.SecurityEventRepository;
import com.lumi.backend.modules.auth.domain.UserAccount;
import com.lumi.backend.support.MutableClock;

import jakarta.persistence.EntityManager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class SecurityEventServiceTest {

    @Mock
    private SecurityEventRepository securityEventRepository;
    @Mock
    private EntityManager entityManager;
    @Mock
    private PlatformTransactionManager transactionManager;

    private MutableClock clock;
    private SecurityEventService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        service = new SecurityEventService(securityEventRepository, entityManager, transactionManager, clock);
    }

    @Test
    void persistsEventWithInferredSeverity() {
        UUID userId = UUID.randomUUID();
        UserAccount reference = new UserAccount();
        when(entityManager.getReference(UserAccount.class, userId)).thenReturn(reference);

        service.log(SecurityEventCommand.of(SecurityEventTypes.REFRESH_TOKEN_REPLAY_DETECTED, userId,
                "203.0.113.7", "curl/8", Map.of("revokedSessions", 2)));

        ArgumentCaptor<SecurityEvent> captor = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(securityEventRepository).save(captor.capture());
        SecurityEvent event = captor.getValue();
        assertThat(event.getType()).isEqualTo(SecurityEventTypes.REFRESH_TOKEN_REPLAY_DETECTED);
        assertThat(event.getUser()).isSameAs(reference);
        assertThat(event.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(event.getSeverity()).isEqualTo(SecurityEventSeverity.CRITICAL);
        assertThat(event.getPayload()).containsEntry("revokedSessions", 2);
        assertThat(event.getCreatedAt()).isEqualTo(OffsetDateTime.now(clock));
        verify(transactionManager).commit(any());
    }

    @Test
    void explicitSeverityWins() {
        assertThat(SecurityEventService.inferSeverity(SecurityEventTypes.LOGIN_FAILED, SecurityEventSeverity.WARNING))
                .isEqualTo(SecurityEventSeverity.WARNING);
        assertThat(SecurityEventService.inferSeverity(SecurityEventTypes.ACCOUNT_LOCKED, null))
                .isEqualTo(SecurityEventSeverity.WARNING);
        assertThat(SecurityEventService.inferSeverity(SecurityEventTypes.LOGIN_SUCCESS, null))
                .isEqualTo(SecurityEventSeverity.INFO);
    }

    @Test
    void storageFailureIsSwallowed() {
        when(securityEventRepository.save(any(SecurityEvent.class)))
                .thenThrow(new DataIntegrityViolationException("boom"));

        assertThatCode(() -> service.log(SecurityEventCommand.of(SecurityEventTypes.LOGOUT, null, null, null, null)))
                .doesNotThrowAnyException();
        verify(transactionManager).rollback(any());
    }
}
