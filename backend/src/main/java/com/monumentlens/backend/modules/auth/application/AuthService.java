package com.monumentlens.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import com.monumentlens.backend.global.config.IdentityProperties;
import com.monumentlens.backend.modules.auth.domain.IssuedSession;
import com.monumentlens.backend.modules.auth.domain.LoginOutcome;
import com.monumentlens.backend.modules.auth.domain.SessionRevocationReason;
import com.monumentlens.backend.modules.auth.domain.UserAccount;
import com.monumentlens.backend.modules.auth.domain.UserContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Entry point for registration, login and session checks. Owns the lockout policy.
 *
 * <p>Credential checks for one identifier run one at a time through {@link LoginThrottle}, so parallel
 * guesses cannot all read a failure count below the threshold. Credential writes and session issue are
 * conditional on the digest the password was verified against.
 *
 * <p>Hashing always runs outside a transaction. Storage failures surface as
 * {@link AuthErrorCode#UNAVAILABLE}; every other failure is an {@link AuthException} with a terminal code.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final CredentialStore credentialStore;
    private final SessionStore sessionStore;
    private final AttemptLog attemptLog;
    private final LoginThrottle loginThrottle;
    private final PasswordHasher passwordHasher;
    private final CredentialRules credentialRules;
    private final TransactionTemplate transactionTemplate;
    private final IdentityProperties properties;
    private final Clock clock;

    public AuthService(
            CredentialStore credentialStore,
            SessionStore sessionStore,
            AttemptLog attemptLog,
            LoginThrottle loginThrottle,
            PasswordHasher passwordHasher,
            CredentialRules credentialRules,
            TransactionTemplate transactionTemplate,
            IdentityProperties properties,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.sessionStore = sessionStore;
        this.attemptLog = attemptLog;
        this.loginThrottle = loginThrottle;
        this.passwordHasher = passwordHasher;
        this.credentialRules = credentialRules;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    public UserAccount register(String username, String email, String password) {
        return register(username, email, null, password);
    }

    public UserAccount register(String username, String email, String fullName, String password) {
        credentialRules.checkRegistration(username, email, fullName, password);

        String salt = passwordHasher.generateSalt();
        int iterations = passwordHasher.defaultIterations();
        String digest = passwordHasher.hash(password, salt, iterations);
        try {
            UserAccount created = StoreCalls.call("registration",
                    () -> credentialStore.create(username, email, fullName, digest, salt, iterations));
            log.info("Registered user {}", created.getId());
            return created;
        } catch (DuplicateCredentialException ex) {
            throw new AuthException(ex.getField() == DuplicateCredentialException.Field.USERNAME
                    ? AuthErrorCode.USERNAME_TAKEN
                    : AuthErrorCode.EMAIL_TAKEN);
        }
    }

    public IssuedSession login(String identifier, String password) {
        return login(identifier, password, null);
    }

    public IssuedSession login(String identifier, String password, String sourceAddress) {
        String submitted = identifier == null ? "" : identifier.trim();
        String secret = password == null ? "" : password;

        UserAccount user = loginThrottle.guard(submitted, () -> checkCredentials(submitted, secret, sourceAddress));

        UUID userId = user.getId();
        String verifiedHash = user.getPasswordHash();
        CredentialStore.Credentials upgrade = passwordHasher.needsRehash(user.getIterations())
                ? freshCredentials(secret)
                : null;
        OffsetDateTime now = OffsetDateTime.now(clock);
        IssuedSession session = StoreCalls.call("session issue", () -> transactionTemplate.execute(status -> {
            if (!credentialStore.confirmLogin(userId, verifiedHash, upgrade, now)) {
                return null;
            }
            return sessionStore.issue(userId, properties.getSession().getTtl());
        }));
        if (session == null) {
            attemptLog.record(submitted, LoginOutcome.BAD_CREDENTIALS, userId, sourceAddress);
            log.info("Login for user {} refused, credentials changed while it was checked", userId);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }
        if (upgrade != null) {
            log.info("Upgraded password digest for user {} to {} iterations", userId, upgrade.iterations());
        }
        attemptLog.record(submitted, LoginOutcome.SUCCESS, userId, sourceAddress);
        log.info("User {} signed in, session expires at {}", userId, session.expiresAt());
        return session;
    }

    public UserContext validateSession(String token) {
        try {
            UserContext context = StoreCalls.call("session validation", () -> sessionStore.validate(token));
            if (!properties.getSession().isSlidingExpiration()) {
                return context;
            }
            OffsetDateTime expiresAt = StoreCalls.call("session extension",
                    () -> sessionStore.extend(token, properties.getSession().getTtl()));
            return new UserContext(context.userId(), context.username(), context.fullName(), expiresAt);
        } catch (SessionRejectedException ex) {
            throw new AuthException(switch (ex.getReason()) {
                case NOT_FOUND -> AuthErrorCode.INVALID_SESSION;
                case EXPIRED -> AuthErrorCode.SESSION_EXPIRED;
                case REVOKED -> AuthErrorCode.SESSION_REVOKED;
            });
        }
    }

    public void logout(String token) {
        boolean revoked = StoreCalls.call("logout", () -> sessionStore.revoke(token, SessionRevocationReason.LOGOUT));
        if (revoked) {
            log.info("Session logged out");
        }
    }

    public void changePassword(UUID userId, String oldPassword, String newPassword) {
        UserAccount user = StoreCalls.call("credential lookup", () -> credentialStore.findById(userId))
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
        String current = oldPassword == null ? "" : oldPassword;
        String identifier = user.getUsername();
        loginThrottle.guard(identifier, () -> {
            requireNotLocked(identifier, null);
            if (!passwordHasher.verify(current, user.getSalt(), user.getIterations(), user.getPasswordHash())) {
                attemptLog.record(identifier, LoginOutcome.BAD_CREDENTIALS, userId, null);
                throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
            }
            return null;
        });
        credentialRules.checkPassword(newPassword);

        CredentialStore.Credentials replacement = freshCredentials(newPassword);
        int revoked = inTransaction("password change", () -> {
            if (!credentialStore.replacePassword(userId, user.getPasswordHash(), replacement)) {
                throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
            }
            return sessionStore.revokeAllForUser(userId, SessionRevocationReason.PASSWORD_CHANGED);
        });
        log.info("Password changed for user {}, {} sessions revoked", userId, revoked);
    }

    public int signOutEverywhere(UUID userId) {
        int revoked = inTransaction("sign out everywhere", () -> {
            if (credentialStore.findById(userId).isEmpty()) {
                throw new UnknownUserException(userId);
            }
            return sessionStore.revokeAllForUser(userId, SessionRevocationReason.SIGN_OUT_EVERYWHERE);
        });
        log.info("Signed out user {} everywhere, {} sessions revoked", userId, revoked);
        return revoked;
    }

    public void disableUser(UUID userId) {
        int revoked = inTransaction("user disable", () -> {
            credentialStore.disable(userId);
            return sessionStore.revokeAllForUser(userId, SessionRevocationReason.USER_DISABLED);
        });
        log.info("Disabled user {}, {} sessions revoked", userId, revoked);
    }

    private UserAccount checkCredentials(String submitted, String secret, String sourceAddress) {
        requireNotLocked(submitted, sourceAddress);

        Optional<UserAccount> found = StoreCalls.call("credential lookup",
                () -> credentialStore.findByIdentifier(submitted));
        if (found.isEmpty()) {
            passwordHasher.burn(secret);
            attemptLog.record(submitted, LoginOutcome.UNKNOWN_IDENTIFIER, null, sourceAddress);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        UserAccount user = found.get();
        if (!passwordHasher.verify(secret, user.getSalt(), user.getIterations(), user.getPasswordHash())) {
            attemptLog.record(submitted, LoginOutcome.BAD_CREDENTIALS, user.getId(), sourceAddress);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }
        if (!user.isActive()) {
            attemptLog.record(submitted, LoginOutcome.DISABLED, user.getId(), sourceAddress);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }
        return user;
    }

    private void requireNotLocked(String identifier, String sourceAddress) {
        IdentityProperties.Lockout lockout = properties.getLockout();
        long failures = StoreCalls.call("lockout check",
                () -> attemptLog.countRecentFailures(identifier, lockout.getWindow()));
        if (failures >= lockout.getMaxFailures()) {
            attemptLog.record(identifier, LoginOutcome.LOCKED, null, sourceAddress);
            log.warn("Credential check refused for locked identifier after {} recent failures", failures);
            throw new AuthException(AuthErrorCode.ACCOUNT_LOCKED);
        }
    }

    private CredentialStore.Credentials freshCredentials(String password) {
        String salt = passwordHasher.generateSalt();
        int iterations = passwordHasher.defaultIterations();
        return new CredentialStore.Credentials(passwordHasher.hash(password, salt, iterations), salt, iterations);
    }

    private int inTransaction(String operation, Supplier<Integer> work) {
        try {
            Integer result = StoreCalls.call(operation, () -> transactionTemplate.execute(status -> work.get()));
            return result != null ? result : 0;
        } catch (UnknownUserException ex) {
            throw new AuthException(AuthErrorCode.USER_NOT_FOUND);
        }
    }
}
