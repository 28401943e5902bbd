package com.monumentlens.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Immutable
@Table(name = "login_attempts")
public class LoginAttempt {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "identifier", nullable = false, length = 320)
    private String identifier;

    @Column(name = "identifier_normalized", nullable = false, length = 320)
    private String identifierNormalized;

    @Column(name = "attempted_at", nullable = false)
    private OffsetDateTime attemptedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 32)
    private LoginOutcome outcome;

    @Column(name = "user_id", columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "source_address", length = 64)
    private String sourceAddress;

    protected LoginAttempt() {
    }

    public LoginAttempt(String identifier, OffsetDateTime attemptedAt, LoginOutcome outcome, UUID userId, String sourceAddress) {
        this.identifier = identifier;
        this.identifierNormalized = UserAccount.normalize(identifier);
        this.attemptedAt = attemptedAt;
        this.outcome = outcome;
        this.userId = userId;
        this.sourceAddress = sourceAddress;
    }

    public UUID getId() {
        return id;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getIdentifierNormalized() {
        return identifierNormalized;
    }

    public OffsetDateTime getAttemptedAt() {
        return attemptedAt;
    }

    public LoginOutcome getOutcome() {
        return outcome;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getSourceAddress() {
        return sourceAddress;
    }
}
