package com.lumi.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lumi.backend.modules.auth.domain.EmailVerificationToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmailVerificationTokenRepository extends JpaRepository<EmailVerificationToken, UUID> {

    @Modifying(flushAutomatically = true)
    @Query("""
            update EmailVerificationToken t
               set t.consumedAt = :now
             where t.user.id = :userId
               and t.consumedAt is null
            """)
    int consumeActiveTokens(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("""
            update EmailVerificationToken t
               set t.consumedAt = :now
             where t.id = :id
               and t.consumedAt is null
            """)
    int consumeIfActive(@Param("id") UUID id, @Param("now") OffsetDateTime now);
}
