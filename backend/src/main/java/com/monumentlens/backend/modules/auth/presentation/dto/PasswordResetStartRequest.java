package com.monumentlens.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetStartRequest(@NotBlank(message = "identifier is required") String identifier) {
}
