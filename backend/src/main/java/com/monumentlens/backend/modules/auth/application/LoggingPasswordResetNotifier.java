package com.monumentlens.backend.modules.auth.application;

import java.time.OffsetDateTime;

import com.monumentlens.backend.modules.auth.domain.UserAccount;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier for local deployments without a mail channel. Logs the issuance, never the token.
 */
@Component
public class LoggingPasswordResetNotifier implements PasswordResetNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingPasswordResetNotifier.class);

    @Override
    public void send(UserAccount user, String token, OffsetDateTime expiresAt) {
        log.info("Password reset token issued for user {} (expires at {})", user.getId(), expiresAt);
    }
}
