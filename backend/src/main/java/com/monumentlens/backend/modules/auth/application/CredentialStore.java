package com.monumentlens.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.UserAccount;
import com.monumentlens.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Only writer of the {@code users} table. Uniqueness is decided by the storage constraints; a violated
 * constraint surfaces as {@link DuplicateCredentialException}.
 */
@Component
public class CredentialStore {

    static final String USERNAME_CONSTRAINT = "uq_users_username_normalized";
    static final String EMAIL_CONSTRAINT = "uq_users_email_normalized";

    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    public CredentialStore(UserAccountRepository userAccountRepository, Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.clock = clock;
    }

    public record ProfileUpdate(String fullName, String email, Map<String, Object> settings) {
    }

    public record Credentials(String passwordHash, String salt, int iterations) {
    }

    @Transactional
    public UserAccount create(String username, String email, String fullName,
                              String passwordHash, String salt, int iterations) {
        UserAccount account = new UserAccount();
        account.setUsername(username.trim());
        account.setEmail(email.trim());
        account.setFullName(fullName != null ? fullName.strip() : null);
        account.setCredentials(passwordHash, salt, iterations);
        try {
            return userAccountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            throw translateDuplicate(ex);
        }
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> findByIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        return userAccountRepository.findByNormalizedIdentifier(UserAccount.normalize(identifier));
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> findById(UUID userId) {
        return userAccountRepository.findById(userId);
    }

    @Transactional
    public void updatePassword(UUID userId, String passwordHash, String salt, int iterations) {
        UserAccount account = loadForUpdate(userId);
        account.setCredentials(passwordHash, salt, iterations);
    }

    /**
     * Replaces the credentials only while the stored digest is still {@code expectedHash}.
     *
     * @return false when the digest changed since the caller verified against it
     */
    @Transactional
    public boolean replacePassword(UUID userId, String expectedHash, Credentials replacement) {
        UserAccount account = loadForUpdate(userId);
        if (!account.getPasswordHash().equals(expectedHash)) {
            return false;
        }
        account.setCredentials(replacement.passwordHash(), replacement.salt(), replacement.iterations());
        return true;
    }

    @Transactional
    public UserAccount updateProfile(UUID userId, ProfileUpdate update) {
        UserAccount account = load(userId);
        if (update.fullName() != null) {
            account.setFullName(update.fullName().strip());
        }
        if (update.email() != null) {
            account.setEmail(update.email().trim());
        }
        if (update.settings() != null) {
            Map<String, Object> merged = new LinkedHashMap<>(account.getProfileSettings());
            merged.putAll(update.settings());
            account.setProfileSettings(merged);
        }
        try {
            return userAccountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            throw translateDuplicate(ex);
        }
    }

    @Transactional
    public void disable(UUID userId) {
        UserAccount account = load(userId);
        if (account.isActive()) {
            account.disable(OffsetDateTime.now(clock));
        }
    }

    /**
     * Stamps {@code last_login_at} under a row lock, provided the account is still active and its digest
     * is the one the password was verified against. A non-null {@code upgrade} replaces the credentials
     * in the same step.
     *
     * @return false when the account was disabled or its password changed after verification
     */
    @Transactional
    public boolean confirmLogin(UUID userId, String verifiedHash, Credentials upgrade, OffsetDateTime at) {
        UserAccount account = loadForUpdate(userId);
        if (!account.isActive() || !account.getPasswordHash().equals(verifiedHash)) {
            return false;
        }
        if (upgrade != null) {
            account.setCredentials(upgrade.passwordHash(), upgrade.salt(), upgrade.iterations());
        }
        account.setLastLoginAt(at);
        return true;
    }

    private UserAccount load(UUID userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new UnknownUserException(userId));
    }

    private UserAccount loadForUpdate(UUID userId) {
        return userAccountRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new UnknownUserException(userId));
    }

    private RuntimeException translateDuplicate(DataIntegrityViolationException ex) {
        String message = Optional.ofNullable(NestedExceptionUtils.getMostSpecificCause(ex).getMessage())
                .orElse("")
                .toLowerCase(Locale.ROOT);
        // match constraint names only; some drivers echo the whole INSERT, which names every column
        if (message.contains(USERNAME_CONSTRAINT)) {
            return new DuplicateCredentialException(DuplicateCredentialException.Field.USERNAME, ex);
        }
        if (message.contains(EMAIL_CONSTRAINT)) {
            return new DuplicateCredentialException(DuplicateCredentialException.Field.EMAIL, ex);
        }
        return ex;
    }
}
