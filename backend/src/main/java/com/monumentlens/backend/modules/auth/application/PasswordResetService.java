package com.monumentlens.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.monumentlens.backend.global.config.IdentityProperties;
import com.monumentlens.backend.modules.auth.domain.PasswordResetRequest;
import com.monumentlens.backend.modules.auth.domain.SessionRevocationReason;
import com.monumentlens.backend.modules.auth.domain.UserAccount;
import com.monumentlens.backend.modules.auth.infrastructure.persistence.PasswordResetRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Single-use, time-bounded password reset tokens. Only the token digest is stored.
 */
@Service
public class PasswordResetService {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);

    private final PasswordResetRequestRepository passwordResetRequestRepository;
    private final CredentialStore credentialStore;
    private final SessionStore sessionStore;
    private final PasswordHasher passwordHasher;
    private final CredentialRules credentialRules;
    private final PasswordResetNotifier notifier;
    private final TransactionTemplate transactionTemplate;
    private final SecureTokens tokens;
    private final IdentityProperties properties;
    private final Clock clock;

    public PasswordResetService(
            PasswordResetRequestRepository passwordResetRequestRepository,
            CredentialStore credentialStore,
            SessionStore sessionStore,
            PasswordHasher passwordHasher,
            CredentialRules credentialRules,
            PasswordResetNotifier notifier,
            TransactionTemplate transactionTemplate,
            IdentityProperties properties,
            Clock clock
    ) {
        this.passwordResetRequestRepository = passwordResetRequestRepository;
        this.credentialStore = credentialStore;
        this.sessionStore = sessionStore;
        this.passwordHasher = passwordHasher;
        this.credentialRules = credentialRules;
        this.notifier = notifier;
        this.transactionTemplate = transactionTemplate;
        this.tokens = new SecureTokens(properties.getSession().getTokenBytes());
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issues a reset token when the identifier names an active user. Returns normally either way so the
     * caller learns nothing about which identifiers exist.
     */
    public void requestReset(String identifier) {
        Optional<UserAccount> found = StoreCalls.call("reset lookup", () -> credentialStore.findByIdentifier(identifier));
        if (found.isEmpty() || !found.get().isActive()) {
            log.debug("Password reset requested for an identifier without an active account");
            return;
        }
        UserAccount user = found.get();
        String token = tokens.newToken();
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plus(properties.getReset().getTtl());
        StoreCalls.run("reset issue", () -> transactionTemplate.executeWithoutResult(status ->
                passwordResetRequestRepository.save(
                        new PasswordResetRequest(SecureTokens.digest(token), user, now, expiresAt))));
        notifier.send(user, token, expiresAt);
    }

    public void confirmReset(String token, String newPassword) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthErrorCode.RESET_TOKEN_INVALID);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        PasswordResetRequest request = StoreCalls.call("reset lookup",
                        () -> passwordResetRequestRepository.findByTokenHashWithUser(SecureTokens.digest(token)))
                .filter(candidate -> !candidate.isUsed())
                .filter(candidate -> now.isBefore(candidate.getExpiresAt()))
                .filter(candidate -> candidate.getUser().isActive())
                .orElseThrow(() -> new AuthException(AuthErrorCode.RESET_TOKEN_INVALID));
        credentialRules.checkPassword(newPassword);

        UUID requestId = request.getId();
        UUID userId = request.getUser().getId();
        String salt = passwordHasher.generateSalt();
        int iterations = passwordHasher.defaultIterations();
        String digest = passwordHasher.hash(newPassword, salt, iterations);

        Integer revoked = StoreCalls.call("reset confirm", () -> transactionTemplate.execute(status -> {
            if (passwordResetRequestRepository.markUsed(requestId, OffsetDateTime.now(clock)) == 0) {
                throw new AuthException(AuthErrorCode.RESET_TOKEN_INVALID);
            }
            credentialStore.updatePassword(userId, digest, salt, iterations);
            return sessionStore.revokeAllForUser(userId, SessionRevocationReason.PASSWORD_RESET);
        }));
        log.info("Password reset completed for user {}, {} sessions revoked", userId, revoked);
    }
}
