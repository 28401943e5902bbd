package com.monumentlens.backend.modules.auth.presentation.dto;

public record RevokeAllResponse(int revoked) {
}
