package com.monumentlens.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RegisterRequest(
        @NotBlank(message = "username is required") String username,
        @NotBlank(message = "email is required") String email,
        String fullName,
        @NotBlank(message = "password is required") String password
) {

    @Override
    public String toString() {
        return "RegisterRequest[username=" + username + ", email=" + email + "]";
    }
}
