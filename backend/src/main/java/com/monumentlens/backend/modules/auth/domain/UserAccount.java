package com.monumentlens.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.monumentlens.backend.global.jpa.AbstractTimestampedEntity;
import com.monumentlens.backend.global.jpa.JsonMapConverter;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Registered user. Holds digest material only; the password itself is never stored.
 */
@Entity
@Table(name = "users")
public class UserAccount extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "username", nullable = false, length = 20)
    private String username;

    @Column(name = "username_normalized", nullable = false, unique = true, length = 20)
    private String usernameNormalized;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "email_normalized", nullable = false, unique = true, length = 320)
    private String emailNormalized;

    @Column(name = "full_name", length = 100)
    private String fullName;

    @Column(name = "password_hash", nullable = false, length = 128)
    private String passwordHash;

    @Column(name = "salt", nullable = false, length = 128)
    private String salt;

    @Column(name = "iterations", nullable = false)
    private int iterations;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private UserStatus status = UserStatus.ACTIVE;

    @Column(name = "disabled_at")
    private OffsetDateTime disabledAt;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "profile_settings", nullable = false, length = 4000)
    private Map<String, Object> profileSettings = new LinkedHashMap<>();

    public static String normalize(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
        this.usernameNormalized = normalize(username);
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
        this.emailNormalized = normalize(email);
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public String getSalt() {
        return salt;
    }

    public int getIterations() {
        return iterations;
    }

    public void setCredentials(String passwordHash, String salt, int iterations) {
        this.passwordHash = passwordHash;
        this.salt = salt;
        this.iterations = iterations;
    }

    public UserStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public OffsetDateTime getDisabledAt() {
        return disabledAt;
    }

    public void disable(OffsetDateTime at) {
        this.status = UserStatus.DISABLED;
        this.disabledAt = at;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public void setLastLoginAt(OffsetDateTime lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }

    public Map<String, Object> getProfileSettings() {
        return profileSettings;
    }

    public void setProfileSettings(Map<String, Object> profileSettings) {
        this.profileSettings = profileSettings != null ? new LinkedHashMap<>(profileSettings) : new LinkedHashMap<>();
    }
}
