package com.monumentlens.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.monumentlens.backend.modules.auth.domain.LoginAttempt;
import com.monumentlens.backend.modules.auth.domain.LoginOutcome;
import com.monumentlens.backend.modules.auth.domain.UserAccount;
import com.monumentlens.backend.modules.auth.infrastructure.persistence.LoginAttemptRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Append-only record of login attempts. Appends commit on their own and a failed append is logged, not
 * raised, so it never undoes a finished credential check.
 */
@Component
public class AttemptLog {

    private static final Logger log = LoggerFactory.getLogger(AttemptLog.class);
    private static final int IDENTIFIER_MAX_LENGTH = 320;
    private static final int SOURCE_MAX_LENGTH = 64;

    private final LoginAttemptRepository loginAttemptRepository;
    private final TransactionTemplate requiresNewTransactionTemplate;
    private final Clock clock;

    public AttemptLog(
            LoginAttemptRepository loginAttemptRepository,
            @Qualifier("requiresNewTransactionTemplate") TransactionTemplate requiresNewTransactionTemplate,
            Clock clock
    ) {
        this.loginAttemptRepository = loginAttemptRepository;
        this.requiresNewTransactionTemplate = requiresNewTransactionTemplate;
        this.clock = clock;
    }

    public void record(String identifier, LoginOutcome outcome, UUID userId, String sourceAddress) {
        LoginAttempt attempt = new LoginAttempt(
                truncate(identifier == null ? "" : identifier.trim(), IDENTIFIER_MAX_LENGTH),
                OffsetDateTime.now(clock),
                outcome,
                userId,
                truncate(sourceAddress, SOURCE_MAX_LENGTH)
        );
        try {
            requiresNewTransactionTemplate.executeWithoutResult(status -> loginAttemptRepository.save(attempt));
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to record login attempt outcome={} userId={}: {}", outcome, userId, ex.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public long countRecentFailures(String identifier, Duration window) {
        String normalized = UserAccount.normalize(identifier == null ? "" : identifier);
        OffsetDateTime since = OffsetDateTime.now(clock).minus(window);
        return loginAttemptRepository.countByIdentifierSince(normalized, LoginOutcome.FAILURES, since);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
