package com.monumentlens.backend.modules.auth.application;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.monumentlens.backend.modules.auth.domain.UserAccount;

import org.springframework.stereotype.Component;

/**
 * Serializes credential checks per normalized identifier, so the failure count a check reads already
 * includes every failure recorded by an earlier check for the same identifier. Identifiers share a fixed
 * set of lock stripes; a collision only serializes two unrelated identifiers.
 *
 * <p>Covers a single application instance. Instances sharing one database do not see each other's locks.
 */
@Component
public class LoginThrottle {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public LoginThrottle() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T guard(String identifier, Supplier<T> check) {
        ReentrantLock lock = stripeFor(identifier);
        lock.lock();
        try {
            return check.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock stripeFor(String identifier) {
        String normalized = UserAccount.normalize(identifier == null ? "" : identifier);
        return locks[Math.floorMod(normalized.hashCode(), STRIPES)];
    }
}
