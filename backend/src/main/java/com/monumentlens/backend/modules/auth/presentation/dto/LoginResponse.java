package com.monumentlens.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record LoginResponse(
        String token,
        String tokenType,
        OffsetDateTime issuedAt,
        OffsetDateTime expiresAt,
        UserProfileResponse user
) {
}
