package com.monumentlens.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetConfirmRequest(
        @NotBlank(message = "token is required") String token,
        @NotBlank(message = "newPassword is required") String newPassword
) {

    @Override
    public String toString() {
        return "PasswordResetConfirmRequest[]";
    }
}
