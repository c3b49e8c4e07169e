package com.lumi.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.lumi.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Modifying(flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.id = :sessionId
               and us.revokedAt is null
            """)
    int revokeIfActive(@Param("sessionId") UUID sessionId,
                       @Param("revokedAt") OffsetDateTime revokedAt,
                       @Param("reason") String reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.id in :sessionIds
               and us.revokedAt is null
            """)
    int revokeAllIfActive(@Param("sessionIds") Collection<UUID> sessionIds,
                          @Param("revokedAt") OffsetDateTime revokedAt,
                          @Param("reason") String reason);

    @Query("""
            select us.id
              from UserSession us
             where us.user.id = :userId
               and us.revokedAt is null
            """)
    List<UUID> findUnrevokedSessionIds(@Param("userId") UUID userId);

    @Query("""
            select us.id
              from UserSession us
             where us.user.id = :userId
               and us.revokedAt is null
               and us.id <> :exceptSessionId
            """)
    List<UUID> findUnrevokedSessionIdsExcept(@Param("userId") UUID userId,
                                             @Param("exceptSessionId") UUID exceptSessionId);

    @Query("""
            select us
              from UserSession us
             where us.user.id = :userId
               and us.fingerprint = :fingerprint
            """)
    List<UserSession> findByUserIdAndFingerprint(@Param("userId") UUID userId,
                                                 @Param("fingerprint") String fingerprint);

    /**
     * Rotates the refresh generation only if {@code expectedTokenId} is still current and the
     * session is live. Returns 0 when a concurrent rotation or revocation got there first.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.refreshTokenHash = :newHash,
                   us.refreshTokenId = :newTokenId,
                   us.expiresAt = :newExpiresAt,
                   us.lastRotatedAt = :rotatedAt
             where us.id = :sessionId
               and us.refreshTokenId = :expectedTokenId
               and us.revokedAt is null
            """)
    int rotateRefreshToken(@Param("sessionId") UUID sessionId,
                           @Param("expectedTokenId") String expectedTokenId,
                           @Param("newHash") String newHash,
                           @Param("newTokenId") String newTokenId,
                           @Param("newExpiresAt") OffsetDateTime newExpiresAt,
                           @Param("rotatedAt") OffsetDateTime rotatedAt);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.revokedAt is null
               and us.expiresAt <= :now
            """)
    int revokeExpiredSessions(@Param("now") OffsetDateTime now,
                              @Param("reason") String reason);
}
