package com.lumi.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.lumi.backend.modules.audit.domain.SecurityEvent;
import com.lumi.backend.modules.audit.domain.SecurityEventSeverity;
import com.lumi.backend.modules.audit.domain.SecurityEventTypes;
import com.lumi.backend.modules.audit.infrastructure.SecurityEventRepository;
import com.lumi.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.EntityManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes security events in their own transaction. A failed write is logged and swallowed so
 * auditing never breaks the operation being audited.
 */
@Service
public class SecurityEventService {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventService.class);

    private static final Set<String> CRITICAL_TYPES = Set.of(
            SecurityEventTypes.REFRESH_TOKEN_REPLAY_DETECTED,
            SecurityEventTypes.SESSION_FINGERPRINT_MISMATCH
    );
    private static final Set<String> WARNING_TYPES = Set.of(
            SecurityEventTypes.ACCOUNT_LOCKED,
            SecurityEventTypes.ACCOUNT_UNLOCK_MANUAL,
            SecurityEventTypes.LOGIN_CAPTCHA_THRESHOLD
    );

    private final SecurityEventRepository securityEventRepository;
    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SecurityEventService(
            SecurityEventRepository securityEventRepository,
            EntityManager entityManager,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.securityEventRepository = securityEventRepository;
        this.entityManager = entityManager;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void log(SecurityEventCommand command) {
        Objects.requireNonNull(command, "command is required");
        Objects.requireNonNull(command.type(), "type is required");
        SecurityEventSeverity severity = inferSeverity(command.type(), command.severity());
        try {
            transactionTemplate.executeWithoutResult(status -> persist(command, severity));
        } catch (RuntimeException ex) {
            log.warn("Failed to persist security event type={} userId={}", command.type(), command.userId(), ex);
        }
    }

    public static SecurityEventSeverity inferSeverity(String type, SecurityEventSeverity explicit) {
        if (explicit != null) {
            return explicit;
        }
        if (CRITICAL_TYPES.contains(type)) {
            return SecurityEventSeverity.CRITICAL;
        }
        if (WARNING_TYPES.contains(type)) {
            return SecurityEventSeverity.WARNING;
        }
        return SecurityEventSeverity.INFO;
    }

    private void persist(SecurityEventCommand command, SecurityEventSeverity severity) {
        SecurityEvent event = new SecurityEvent();
        event.setType(command.type());
        if (command.userId() != null) {
            event.setUser(entityManager.getReference(UserAccount.class, command.userId()));
        }
        event.setIpAddress(command.ipAddress());
        event.setUserAgent(command.userAgent());
        event.setSeverity(severity);
        if (command.payload() != null && !command.payload().isEmpty()) {
            event.setPayload(new LinkedHashMap<>(command.payload()));
        }
        event.setCreatedAt(OffsetDateTime.now(clock));
        securityEventRepository.save(event);

        if (severity == SecurityEventSeverity.CRITICAL) {
            log.warn("Critical security event {} for user {}", command.type(), command.userId());
        }
    }

    public record SecurityEventCommand(
            String type,
            UUID userId,
            String ipAddress,
            String userAgent,
            Map<String, Object> payload,
            SecurityEventSeverity severity
    ) {

        public static SecurityEventCommand of(String type, UUID userId, String ipAddress, String userAgent,
                                              Map<String, Object> payload) {
            return new SecurityEventCommand(type, userId, ipAddress, userAgent, payload, null);
        }

        public SecurityEventCommand withSeverity(SecurityEventSeverity severity) {
            return new SecurityEventCommand(type, userId, ipAddress, userAgent, payload, severity);
        }
    }
}
