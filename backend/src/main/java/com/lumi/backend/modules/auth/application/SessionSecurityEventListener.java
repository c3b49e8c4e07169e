package com.lumi.backend.modules.auth.application;

import com.lumi.backend.modules.audit.application.SecurityEventService.SecurityEventCommand;
import com.lumi.backend.modules.audit.domain.SecurityEventSeverity;
import com.lumi.backend.modules.audit.domain.SecurityEventTypes;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns session store events into security audit records.
 */
@Component
public class SessionSecurityEventListener {

    private final AuthEventDispatcher dispatcher;

    public SessionSecurityEventListener(AuthEventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @EventListener
    public void onSessionRevoked(SessionRevokedEvent event) {
        dispatcher.securityEvent(SecurityEventCommand.of(
                SecurityEventTypes.SESSION_REVOKED,
                event.userId(),
                null,
                null,
                AuthEventDispatcher.payload(
                        "sessionIds", event.sessionIds().stream().map(Object::toString).toList(),
                        "count", event.sessionIds().size(),
                        "reason", event.reason(),
                        "revokedAt", event.revokedAt().toString()
                )
        ).withSeverity(SecurityEventSeverity.WARNING));
    }

    @EventListener
    public void onFingerprintMismatch(SessionFingerprintMismatchEvent event) {
        dispatcher.securityEvent(SecurityEventCommand.of(
                SecurityEventTypes.SESSION_FINGERPRINT_MISMATCH,
                event.userId(),
                event.ipAddress(),
                event.userAgent(),
                AuthEventDispatcher.payload(
                        "sessionId", event.sessionId().toString(),
                        "detectedAt", event.detectedAt().toString()
                )
        ));
    }
}
