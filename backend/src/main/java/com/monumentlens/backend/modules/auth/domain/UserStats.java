package com.monumentlens.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record UserStats(
        UUID userId,
        OffsetDateTime memberSince,
        OffsetDateTime lastLoginAt,
        long activeSessions,
        Map<String, Object> settings
) {
}
