package com.lumi.backend.modules.auth.application;

import java.util.Map;
import java.util.UUID;

import com.lumi.backend.global.error.UnauthorizedProblemException;

/**
 * A refresh token was presented after it had already been rotated. Every session of the user
 * has been revoked by the time this is thrown.
 */
public class TokenReuseDetectedException extends UnauthorizedProblemException {

    private final UUID userId;
    private final UUID sessionId;
    private final int revokedCount;

    public TokenReuseDetectedException(UUID userId, UUID sessionId, int revokedCount) {
        super("token_reuse_detected",
                "Refresh token reuse detected. All sessions have been signed out.",
                Map.of("sessionId", sessionId, "revokedSessions", revokedCount));
        this.userId = userId;
        this.sessionId = sessionId;
        this.revokedCount = revokedCount;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public int getRevokedCount() {
        return revokedCount;
    }
}
