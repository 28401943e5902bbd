package com.monumentlens.backend.modules.auth.application;

import java.util.Map;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.UserAccount;
import com.monumentlens.backend.modules.auth.domain.UserProfile;
import com.monumentlens.backend.modules.auth.domain.UserStats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final CredentialStore credentialStore;
    private final SessionStore sessionStore;
    private final CredentialRules credentialRules;

    public ProfileService(CredentialStore credentialStore, SessionStore sessionStore, CredentialRules credentialRules) {
        this.credentialStore = credentialStore;
        this.sessionStore = sessionStore;
        this.credentialRules = credentialRules;
    }

    public UserProfile loadProfile(UUID userId) {
        return UserProfile.from(load(userId));
    }

    /**
     * Changes the full name and/or email; {@code null} leaves a field untouched.
     */
    public UserProfile updateProfile(UUID userId, String fullName, String email) {
        if (fullName != null) {
            credentialRules.checkFullName(fullName);
        }
        if (email != null) {
            credentialRules.checkEmail(email);
        }
        return update(userId, new CredentialStore.ProfileUpdate(fullName, email, null));
    }

    /**
     * Merges {@code settings} into the stored settings; keys not named keep their values.
     */
    public UserProfile updateSettings(UUID userId, Map<String, Object> settings) {
        return update(userId, new CredentialStore.ProfileUpdate(null, null, settings == null ? Map.of() : settings));
    }

    public UserStats loadStats(UUID userId) {
        UserAccount account = load(userId);
        long activeSessions = StoreCalls.call("session count", () -> sessionStore.countActiveForUser(userId));
        return new UserStats(
                account.getId(),
                account.getCreatedAt(),
                account.getLastLoginAt(),
                activeSessions,
                UserProfile.from(account).settings()
        );
    }

    private UserProfile update(UUID userId, CredentialStore.ProfileUpdate update) {
        try {
            UserAccount updated = StoreCalls.call("profile update", () -> credentialStore.updateProfile(userId, update));
            log.info("Updated profile of user {}", userId);
            return UserProfile.from(updated);
        } catch (UnknownUserException ex) {
            throw new AuthException(AuthErrorCode.USER_NOT_FOUND);
        } catch (DuplicateCredentialException ex) {
            throw new AuthException(ex.getField() == DuplicateCredentialException.Field.EMAIL
                    ? AuthErrorCode.EMAIL_TAKEN
                    : AuthErrorCode.USERNAME_TAKEN);
        }
    }

    private UserAccount load(UUID userId) {
        return StoreCalls.call("profile lookup", () -> credentialStore.findById(userId))
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
    }
}
