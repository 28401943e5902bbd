package com.monumentlens.backend.modules.auth.presentation;

import com.monumentlens.backend.global.security.SessionTokenAuthenticationFilter;
import com.monumentlens.backend.modules.auth.application.AuthService;
import com.monumentlens.backend.modules.auth.application.PasswordResetService;
import com.monumentlens.backend.modules.auth.application.ProfileService;
import com.monumentlens.backend.modules.auth.domain.IssuedSession;
import com.monumentlens.backend.modules.auth.domain.UserAccount;
import com.monumentlens.backend.modules.auth.presentation.dto.LoginRequest;
import com.monumentlens.backend.modules.auth.presentation.dto.LoginResponse;
import com.monumentlens.backend.modules.auth.presentation.dto.PasswordResetConfirmRequest;
import com.monumentlens.backend.modules.auth.presentation.dto.PasswordResetStartRequest;
import com.monumentlens.backend.modules.auth.presentation.dto.RegisterRequest;
import com.monumentlens.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Auth")
public class AuthController {

    private static final String TOKEN_TYPE = "Bearer";

    private final AuthService authService;
    private final ProfileService profileService;
    private final PasswordResetService passwordResetService;

    public AuthController(AuthService authService, ProfileService profileService, PasswordResetService passwordResetService) {
        this.authService = authService;
        this.profileService = profileService;
        this.passwordResetService = passwordResetService;
    }

    @Operation(summary = "Register a new user")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "User created"),
            @ApiResponse(responseCode = "409", description = "`USERNAME_TAKEN` or `EMAIL_TAKEN`"),
            @ApiResponse(responseCode = "422", description = "A username, email, name or password rule failed")
    })
    @PostMapping("/register")
    public ResponseEntity<UserProfileResponse> register(@Valid @RequestBody RegisterRequest request) {
        UserAccount account = authService.register(request.username(), request.email(), request.fullName(), request.password());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(UserProfileResponse.from(profileService.loadProfile(account.getId())));
    }

    @Operation(
            summary = "Sign in with username or email",
            description = """
                    Returns a bearer session token. Repeated failures for the same identifier lock further \
                    attempts for the configured window with 423 `ACCOUNT_LOCKED`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session issued"),
            @ApiResponse(responseCode = "401", description = "`INVALID_CREDENTIALS`"),
            @ApiResponse(responseCode = "423", description = "`ACCOUNT_LOCKED`")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        IssuedSession session = authService.login(request.identifier(), request.password(), httpRequest.getRemoteAddr());
        UserProfileResponse user = UserProfileResponse.from(profileService.loadProfile(session.userId()));
        return ResponseEntity.ok(new LoginResponse(session.token(), TOKEN_TYPE, session.issuedAt(), session.expiresAt(), user));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest httpRequest) {
        String token = SessionTokenAuthenticationFilter.extractBearerToken(httpRequest);
        if (token != null) {
            authService.logout(token);
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Request a password reset token", description = "Always answers 202, known identifier or not.")
    @PostMapping("/password-reset")
    public ResponseEntity<Void> requestPasswordReset(@Valid @RequestBody PasswordResetStartRequest request) {
        passwordResetService.requestReset(request.identifier());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/password-reset/confirm")
    public ResponseEntity<Void> confirmPasswordReset(@Valid @RequestBody PasswordResetConfirmRequest request) {
        passwordResetService.confirmReset(request.token(), request.newPassword());
        return ResponseEntity.noContent().build();
    }
}
