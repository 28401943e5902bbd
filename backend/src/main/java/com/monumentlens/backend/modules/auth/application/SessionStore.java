package com.monumentlens.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import com.monumentlens.backend.global.config.IdentityProperties;
import com.monumentlens.backend.modules.auth.domain.IssuedSession;
import com.monumentlens.backend.modules.auth.domain.SessionRevocationReason;
import com.monumentlens.backend.modules.auth.domain.UserAccount;
import com.monumentlens.backend.modules.auth.domain.UserContext;
import com.monumentlens.backend.modules.auth.domain.UserSession;
import com.monumentlens.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.monumentlens.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Issued sessions keyed by the SHA-256 digest of their bearer token.
 */
@Component
public class SessionStore {

    private final UserSessionRepository userSessionRepository;
    private final UserAccountRepository userAccountRepository;
    private final TransactionTemplate transactionTemplate;
    private final SecureTokens tokens;
    private final Duration maxLifetime;
    private final int sweepBatchSize;
    private final Clock clock;

    public SessionStore(
            UserSessionRepository userSessionRepository,
            UserAccountRepository userAccountRepository,
            TransactionTemplate transactionTemplate,
            IdentityProperties properties,
            Clock clock
    ) {
        this.userSessionRepository = userSessionRepository;
        this.userAccountRepository = userAccountRepository;
        this.transactionTemplate = transactionTemplate;
        this.tokens = new SecureTokens(properties.getSession().getTokenBytes());
        this.maxLifetime = properties.getSession().getMaxLifetime();
        this.sweepBatchSize = properties.getSession().getSweepBatchSize();
        this.clock = clock;
    }

    @Transactional
    public IssuedSession issue(UUID userId, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Session TTL must be positive");
        }
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new UnknownUserException(userId));
        // storage keeps microseconds; truncate so the returned window matches the stored one
        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        String token = tokens.newToken();

        UserSession session = new UserSession();
        session.setTokenHash(SecureTokens.digest(token));
        session.setUser(user);
        session.setIssuedAt(now);
        session.setExpiresAt(cap(now, now.plus(ttl)));
        userSessionRepository.save(session);
        return new IssuedSession(token, userId, session.getIssuedAt(), session.getExpiresAt());
    }

    /**
     * Resolves a bearer token to its user.
     *
     * @throws SessionRejectedException when the token is unknown, expired, revoked, or its user is disabled
     */
    @Transactional(readOnly = true)
    public UserContext validate(String token) {
        if (token == null || token.isBlank()) {
            throw new SessionRejectedException(SessionRejectedException.Reason.NOT_FOUND);
        }
        UserSession session = userSessionRepository.findByTokenHashWithUser(SecureTokens.digest(token))
                .orElseThrow(() -> new SessionRejectedException(SessionRejectedException.Reason.NOT_FOUND));
        if (session.isRevoked() || !session.getUser().isActive()) {
            throw new SessionRejectedException(SessionRejectedException.Reason.REVOKED);
        }
        if (session.isExpiredAt(OffsetDateTime.now(clock))) {
            throw new SessionRejectedException(SessionRejectedException.Reason.EXPIRED);
        }
        UserAccount user = session.getUser();
        return new UserContext(user.getId(), user.getUsername(), user.getFullName(), session.getExpiresAt());
    }

    /**
     * Moves expiry to {@code now + ttl}, never past the lifetime cap and never backwards.
     *
     * @return the expiry in effect after the call
     */
    @Transactional
    public OffsetDateTime extend(String token, Duration ttl) {
        String tokenHash = SecureTokens.digest(token);
        UserSession session = userSessionRepository.findByTokenHashWithUser(tokenHash)
                .orElseThrow(() -> new SessionRejectedException(SessionRejectedException.Reason.NOT_FOUND));
        OffsetDateTime candidate = cap(session.getIssuedAt(), OffsetDateTime.now(clock).plus(ttl));
        if (candidate.isAfter(session.getExpiresAt())) {
            userSessionRepository.extendExpiry(tokenHash, candidate);
            return candidate;
        }
        return session.getExpiresAt();
    }

    @Transactional
    public boolean revoke(String token, SessionRevocationReason reason) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return userSessionRepository.revokeByTokenHash(SecureTokens.digest(token), OffsetDateTime.now(clock), reason) > 0;
    }

    @Transactional
    public int revokeAllForUser(UUID userId, SessionRevocationReason reason) {
        return userSessionRepository.revokeAllByUserId(userId, OffsetDateTime.now(clock), reason);
    }

    @Transactional(readOnly = true)
    public long countActiveForUser(UUID userId) {
        return userSessionRepository.countActiveByUserId(userId, OffsetDateTime.now(clock));
    }

    /**
     * Deletes sessions whose expiry has passed, one short transaction per batch.
     *
     * @return number of rows removed
     */
    public int sweepExpired() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int removed = 0;
        while (true) {
            Integer deleted = transactionTemplate.execute(status -> {
                List<UUID> ids = userSessionRepository.findExpiredIds(now, PageRequest.of(0, sweepBatchSize));
                if (!ids.isEmpty()) {
                    userSessionRepository.deleteAllByIdInBatch(ids);
                }
                return ids.size();
            });
            int count = deleted != null ? deleted : 0;
            removed += count;
            if (count < sweepBatchSize) {
                return removed;
            }
        }
    }

    private OffsetDateTime cap(OffsetDateTime issuedAt, OffsetDateTime requested) {
        OffsetDateTime ceiling = issuedAt.plus(maxLifetime);
        return requested.isAfter(ceiling) ? ceiling : requested;
    }
}
