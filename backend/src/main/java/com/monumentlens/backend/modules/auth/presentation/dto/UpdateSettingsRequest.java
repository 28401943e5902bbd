package com.monumentlens.backend.modules.auth.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateSettingsRequest(
        @NotNull(message = "settings is required")
        @Size(max = 50, message = "at most 50 settings per request")
        Map<String, Object> settings
) {
}
