package com.lumi.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lumi.backend.global.common.FieldUpdate;
import com.lumi.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Customer account. The email is stored normalized (trimmed, lower case). Accounts are
 * deactivated, never deleted.
 */
@Entity
@Table(name = "user_account")
public class UserAccount extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "phone", length = 32)
    private String phone;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "email_verified_at")
    private OffsetDateTime emailVerifiedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private UserAccountStatus status = UserAccountStatus.ACTIVE;

    @Column(name = "failed_login_count", nullable = false)
    private int failedLoginCount;

    @Column(name = "lockout_until")
    private OffsetDateTime lockoutUntil;

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public OffsetDateTime getEmailVerifiedAt() {
        return emailVerifiedAt;
    }

    public void markEmailVerified(OffsetDateTime verifiedAt) {
        this.emailVerified = true;
        this.emailVerifiedAt = verifiedAt;
    }

    public UserAccountStatus getStatus() {
        return status;
    }

    public void setStatus(UserAccountStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return status == UserAccountStatus.ACTIVE;
    }

    public int getFailedLoginCount() {
        return failedLoginCount;
    }

    public OffsetDateTime getLockoutUntil() {
        return lockoutUntil;
    }

    public void applyLockoutState(int failedLoginCount, FieldUpdate<OffsetDateTime> lockoutUpdate) {
        if (failedLoginCount < 0) {
            throw new IllegalArgumentException("failedLoginCount must be >= 0");
        }
        this.failedLoginCount = failedLoginCount;
        this.lockoutUntil = lockoutUpdate.applyTo(this.lockoutUntil);
    }

    public String getDisplayName() {
        if (firstName != null && !firstName.isBlank()) {
            return firstName;
        }
        return email;
    }
}
