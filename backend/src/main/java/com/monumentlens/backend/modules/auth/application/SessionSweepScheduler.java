package com.monumentlens.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

@Component
@ConditionalOnProperty(prefix = "app.identity.session", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class SessionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionSweepScheduler.class);

    private final SessionStore sessionStore;

    public SessionSweepScheduler(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(
            initialDelayString = "${app.identity.session.sweep-interval:PT1H}",
            fixedDelayString = "${app.identity.session.sweep-interval:PT1H}"
    )
    public void sweepExpiredSessions() {
        try {
            int removed = sessionStore.sweepExpired();
            if (removed > 0) {
                log.info("Removed {} expired sessions", removed);
            }
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Expired session sweep failed, will retry on the next run: {}", ex.getMessage());
        }
    }
}
