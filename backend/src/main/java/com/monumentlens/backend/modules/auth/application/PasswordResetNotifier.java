package com.monumentlens.backend.modules.auth.application;

import java.time.OffsetDateTime;

import com.monumentlens.backend.modules.auth.domain.UserAccount;

/**
 * Delivers a freshly issued reset token to its owner. The raw token exists only for the duration of this call.
 */
public interface PasswordResetNotifier {

    void send(UserAccount user, String token, OffsetDateTime expiresAt);
}
