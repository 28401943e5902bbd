package com.monumentlens.backend.global.security;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionPrincipal(UUID userId, String username, String fullName, OffsetDateTime sessionExpiresAt) {
}
