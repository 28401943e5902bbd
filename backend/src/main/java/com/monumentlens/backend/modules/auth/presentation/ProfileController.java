package com.monumentlens.backend.modules.auth.presentation;

import com.monumentlens.backend.global.security.SessionPrincipal;
import com.monumentlens.backend.modules.auth.application.AuthService;
import com.monumentlens.backend.modules.auth.application.ProfileService;
import com.monumentlens.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.monumentlens.backend.modules.auth.presentation.dto.RevokeAllResponse;
import com.monumentlens.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.monumentlens.backend.modules.auth.presentation.dto.UpdateSettingsRequest;
import com.monumentlens.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.monumentlens.backend.modules.auth.presentation.dto.UserStatsResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profile/me")
@Tag(name = "Profile")
public class ProfileController {

    private final ProfileService profileService;
    private final AuthService authService;

    public ProfileController(ProfileService profileService, AuthService authService) {
        this.profileService = profileService;
        this.authService = authService;
    }

    @GetMapping
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal SessionPrincipal principal) {
        return ResponseEntity.ok(UserProfileResponse.from(profileService.loadProfile(principal.userId())));
    }

    @PatchMapping
    public ResponseEntity<UserProfileResponse> updateProfile(
            @AuthenticationPrincipal SessionPrincipal principal,
            @RequestBody UpdateProfileRequest request
    ) {
        return ResponseEntity.ok(UserProfileResponse.from(
                profileService.updateProfile(principal.userId(), request.fullName(), request.email())));
    }

    @Operation(summary = "Merge settings", description = "Keys in the request overwrite stored keys; other keys are kept.")
    @PutMapping("/settings")
    public ResponseEntity<UserProfileResponse> updateSettings(
            @AuthenticationPrincipal SessionPrincipal principal,
            @Valid @RequestBody UpdateSettingsRequest request
    ) {
        return ResponseEntity.ok(UserProfileResponse.from(
                profileService.updateSettings(principal.userId(), request.settings())));
    }

    @GetMapping("/stats")
    public ResponseEntity<UserStatsResponse> stats(@AuthenticationPrincipal SessionPrincipal principal) {
        return ResponseEntity.ok(UserStatsResponse.from(profileService.loadStats(principal.userId())));
    }

    @Operation(summary = "Change password", description = "Revokes every session of the user, the calling one included.")
    @PostMapping("/password")
    public ResponseEntity<Void> changePassword(
            @AuthenticationPrincipal SessionPrincipal principal,
            @Valid @RequestBody ChangePasswordRequest request
    ) {
        authService.changePassword(principal.userId(), request.currentPassword(), request.newPassword());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sessions/revoke-all")
    public ResponseEntity<RevokeAllResponse> revokeAllSessions(@AuthenticationPrincipal SessionPrincipal principal) {
        return ResponseEntity.ok(new RevokeAllResponse(authService.signOutEverywhere(principal.userId())));
    }
}
