package com.monumentlens.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.UserProfile;

public record UserProfileResponse(
        UUID userId,
        String username,
        String email,
        String fullName,
        Map<String, Object> settings,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime lastLoginAt
) {

    public static UserProfileResponse from(UserProfile profile) {
        return new UserProfileResponse(
                profile.userId(),
                profile.username(),
                profile.email(),
                profile.fullName(),
                profile.settings(),
                profile.status().name(),
                profile.createdAt(),
                profile.lastLoginAt()
        );
    }
}
