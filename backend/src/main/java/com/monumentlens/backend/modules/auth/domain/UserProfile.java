package com.monumentlens.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record UserProfile(
        UUID userId,
        String username,
        String email,
        String fullName,
        Map<String, Object> settings,
        UserStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime lastLoginAt
) {

    public static UserProfile from(UserAccount account) {
        return new UserProfile(
                account.getId(),
                account.getUsername(),
                account.getEmail(),
                account.getFullName(),
                Collections.unmodifiableMap(new LinkedHashMap<>(account.getProfileSettings())),
                account.getStatus(),
                account.getCreatedAt(),
                account.getLastLoginAt()
        );
    }
}
