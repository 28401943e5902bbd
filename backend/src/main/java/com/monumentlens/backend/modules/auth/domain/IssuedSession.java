package com.monumentlens.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Result of a successful login. {@code token} is the only copy of the raw bearer value.
 */
public record IssuedSession(String token, UUID userId, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {

    @Override
    public String toString() {
        return "IssuedSession[userId=" + userId + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
