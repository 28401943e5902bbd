package com.monumentlens.backend.modules.auth.presentation.dto;

/**
 * Absent fields are left unchanged.
 */
public record UpdateProfileRequest(String fullName, String email) {
}
