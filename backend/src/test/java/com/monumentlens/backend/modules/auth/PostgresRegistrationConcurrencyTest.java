package com.monumentlens.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.monumentlens.backend.modules.auth.application.AuthErrorCode;
import com.monumentlens.backend.modules.auth.application.AuthException;
import com.monumentlens.backend.modules.auth.application.AuthService;
import com.monumentlens.backend.modules.auth.domain.IssuedSession;
import com.monumentlens.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.monumentlens.backend.support.AbstractPostgresIntegrationTest;
import com.monumentlens.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PostgresRegistrationConcurrencyTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = TestUserFactory.DEFAULT_PASSWORD;

    @Autowired
    AuthService authService;

    @Autowired
    UserAccountRepository userAccountRepository;

    @Test
    void racingEmailsAreResolvedByTheEmailConstraint() throws Exception {
        int contenders = 6;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AuthErrorCode>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String username = "pg_racer" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        authService.register(username, "Shared@Example.com", PASSWORD);
                        return null;
                    } catch (AuthException ex) {
                        return ex.getErrorCode();
                    }
                }));
            }
            start.countDown();

            List<AuthErrorCode> outcomes = new ArrayList<>();
            for (Future<AuthErrorCode> result : results) {
                outcomes.add(result.get(30, TimeUnit.SECONDS));
            }
            assertThat(outcomes.stream().filter(code -> code == null).count()).isEqualTo(1);
            assertThat(outcomes.stream().filter(code -> code != null))
                    .hasSize(contenders - 1)
                    .containsOnly(AuthErrorCode.EMAIL_TAKEN);
            assertThat(userAccountRepository.count()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void caseVariantUsernameIsRejectedAndLoginWorks() {
        authService.register("Mixed_Case", "mixed@example.com", PASSWORD);

        AuthException ex = assertThrows(AuthException.class,
                () -> authService.register("mixed_case", "other@example.com", PASSWORD));
        assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.USERNAME_TAKEN);

        IssuedSession session = authService.login("MIXED_CASE", PASSWORD);
        assertThat(authService.validateSession(session.token()).username()).isEqualTo("Mixed_Case");
    }
}
