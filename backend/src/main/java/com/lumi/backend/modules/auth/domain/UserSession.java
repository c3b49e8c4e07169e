package com.lumi.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lumi.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.DynamicUpdate;

/**
 * One logged-in device. The id is chosen before persistence because it is embedded in the
 * refresh token. Only a hash of the refresh secret is stored; {@code refreshTokenId} names the
 * current refresh generation and changes on every rotation.
 */
@Entity
@DynamicUpdate
@Table(name = "user_session")
public class UserSession extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_account_id", nullable = false, updatable = false)
    private UserAccount user;

    @Column(name = "fingerprint", length = 128)
    private String fingerprint;

    @Column(name = "refresh_token_hash", nullable = false, length = 128)
    private String refreshTokenHash;

    @Column(name = "refresh_token_id", nullable = false, length = 64)
    private String refreshTokenId;

    @Column(name = "last_rotated_at", nullable = false)
    private OffsetDateTime lastRotatedAt;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "revoked_reason", length = 100)
    private String revokedReason;

    protected UserSession() {
    }

    public UserSession(UUID id) {
        this.id = id;
    }

    public UUID getId() {
        return id;
    }

    public UserAccount getUser() {
        return user;
    }

    public void setUser(UserAccount user) {
        this.user = user;
    }

    public UUID getUserId() {
        return user != null ? user.getId() : null;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getRefreshTokenHash() {
        return refreshTokenHash;
    }

    public void setRefreshTokenHash(String refreshTokenHash) {
        this.refreshTokenHash = refreshTokenHash;
    }

    public String getRefreshTokenId() {
        return refreshTokenId;
    }

    public void setRefreshTokenId(String refreshTokenId) {
        this.refreshTokenId = refreshTokenId;
    }

    public OffsetDateTime getLastRotatedAt() {
        return lastRotatedAt;
    }

    public void setLastRotatedAt(OffsetDateTime lastRotatedAt) {
        this.lastRotatedAt = lastRotatedAt;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public void setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public String getRevokedReason() {
        return revokedReason;
    }

    public void revoke(OffsetDateTime revokedAt, String reason) {
        this.revokedAt = revokedAt;
        this.revokedReason = reason;
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isActiveAt(OffsetDateTime now) {
        return !isRevoked() && !isExpiredAt(now);
    }
}
