package com.monumentlens.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.UserStats;

public record UserStatsResponse(
        UUID userId,
        OffsetDateTime memberSince,
        OffsetDateTime lastLoginAt,
        long activeSessions,
        Map<String, Object> settings
) {

    public static UserStatsResponse from(UserStats stats) {
        return new UserStatsResponse(
                stats.userId(),
                stats.memberSince(),
                stats.lastLoginAt(),
                stats.activeSessions(),
                stats.settings()
        );
    }
}
