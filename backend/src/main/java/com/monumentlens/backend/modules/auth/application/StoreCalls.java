package com.monumentlens.backend.modules.auth.application;

import java.util.function.Supplier;

import com.monumentlens.backend.global.error.RetryableProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

/**
 * Maps storage failures to {@link AuthErrorCode#UNAVAILABLE}. The storage message is logged here and
 * never copied into the exception that reaches the caller.
 */
final class StoreCalls {

    private static final Logger log = LoggerFactory.getLogger(StoreCalls.class);
    static final int RETRY_AFTER_SECONDS = 2;

    private StoreCalls() {
    }

    static <T> T call(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Identity store failure during {}: {}", operation, ex.getMessage(), ex);
            throw unavailable(ex);
        }
    }

    static void run(String operation, Runnable work) {
        call(operation, () -> {
            work.run();
            return null;
        });
    }

    static RetryableProblemException unavailable(Throwable cause) {
        AuthErrorCode code = AuthErrorCode.UNAVAILABLE;
        return new RetryableProblemException(code.getStatus(), code.name(), code.getDefaultDetail(), RETRY_AFTER_SECONDS, cause);
    }
}
