package com.monumentlens.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Authenticated identity handed to collaborating subsystems after a session validates.
 */
public record UserContext(UUID userId, String username, String fullName, OffsetDateTime sessionExpiresAt) {
}
