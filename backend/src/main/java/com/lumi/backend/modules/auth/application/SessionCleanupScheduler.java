package com.lumi.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "lumi.auth.session.cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class SessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionCleanupScheduler.class);

    private final SessionService sessionService;

    public SessionCleanupScheduler(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Scheduled(fixedDelayString = "${lumi.auth.session.cleanup-interval:PT5M}",
            initialDelayString = "${lumi.auth.session.cleanup-interval:PT5M}")
    public void revokeExpiredSessions() {
        try {
            sessionService.revokeExpiredSessions();
        } catch (RuntimeException ex) {
            log.error("Expired session cleanup failed", ex);
        }
    }
}
