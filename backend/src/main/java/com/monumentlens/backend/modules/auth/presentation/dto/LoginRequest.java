package com.monumentlens.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param identifier username or email
 */
public record LoginRequest(
        @NotBlank(message = "identifier is required") String identifier,
        @NotBlank(message = "password is required") String password
) {

    @Override
    public String toString() {
        return "LoginRequest[identifier=" + identifier + "]";
    }
}
