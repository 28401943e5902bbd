package com.monumentlens.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.monumentlens.backend.modules.auth.application.AuthErrorCode;
import com.monumentlens.backend.modules.auth.application.AuthException;
import com.monumentlens.backend.modules.auth.application.AuthService;
import com.monumentlens.backend.modules.auth.application.CredentialStore;
import com.monumentlens.backend.modules.auth.application.PasswordHasher;
import com.monumentlens.backend.modules.auth.domain.IssuedSession;
import com.monumentlens.backend.modules.auth.domain.LoginAttempt;
import com.monumentlens.backend.modules.auth.domain.LoginOutcome;
import com.monumentlens.backend.modules.auth.domain.UserAccount;
import com.monumentlens.backend.modules.auth.domain.UserContext;
import com.monumentlens.backend.modules.auth.infrastructure.persistence.LoginAttemptRepository;
import com.monumentlens.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.monumentlens.backend.support.AbstractIntegrationTest;
import com.monumentlens.backend.support.TestUserFactory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

class AuthServiceTest extends AbstractIntegrationTest {

    private static final String PASSWORD = TestUserFactory.DEFAULT_PASSWORD;

    @Autowired
    AuthService authService;

    @Autowired
    CredentialStore credentialStore;

    @Autowired
    PasswordHasher passwordHasher;

    @Autowired
    UserAccountRepository userAccountRepository;

    @Autowired
    LoginAttemptRepository loginAttemptRepository;

    @Autowired
    TestUserFactory testUserFactory;

    @Test
    @DisplayName("alice registers, signs in, is recognised and signs out")
    void aliceScenario() {
        UserAccount alice = authService.register("alice", "alice@example.com", PASSWORD);

        IssuedSession session = authService.login("alice", PASSWORD);
        assertThat(session.userId()).isEqualTo(alice.getId());
        assertThat(session.expiresAt()).isEqualTo(session.issuedAt().plusDays(30));

        UserContext context = authService.validateSession(session.token());
        assertThat(context.userId()).isEqualTo(alice.getId());
        assertThat(context.username()).isEqualTo("alice");

        authService.logout(session.token());

        AuthException ex = assertThrows(AuthException.class, () -> authService.validateSession(session.token()));
        assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.SESSION_REVOKED);
        assertDoesNotThrow(() -> authService.logout(session.token()));
    }

    @Test
    void loginAcceptsEmailAndIgnoresIdentifierCase() {
        UserAccount user = testUserFactory.register("Marco_Polo");

        assertThat(authService.login("marco_polo", PASSWORD).userId()).isEqualTo(user.getId());
        assertThat(authService.login("  MARCO_POLO@Example.com ", PASSWORD).userId()).isEqualTo(user.getId());

        UserAccount stored = userAccountRepository.findById(user.getId()).orElseThrow();
        assertThat(stored.getUsername()).isEqualTo("Marco_Polo");
        assertThat(stored.getLastLoginAt()).isNotNull();
    }

    @Test
    void passwordIsNeverStoredInPlainText() {
        UserAccount user = testUserFactory.register("carol");

        UserAccount stored = userAccountRepository.findById(user.getId()).orElseThrow();
        assertThat(stored.getPasswordHash()).doesNotContain(PASSWORD).hasSize(64);
        assertThat(stored.getSalt()).hasSize(32);
        assertThat(passwordHasher.verify(PASSWORD, stored.getSalt(), stored.getIterations(), stored.getPasswordHash()))
                .isTrue();
    }

    @Test
    void duplicateUsernameAndEmailAreRejectedCaseInsensitively() {
        testUserFactory.register("dora");

        AuthException username = assertThrows(AuthException.class,
                () -> authService.register("DORA", "other@example.com", PASSWORD));
        assertThat(username.getErrorCode()).isEqualTo(AuthErrorCode.USERNAME_TAKEN);

        AuthException email = assertThrows(AuthException.class,
                () -> authService.register("dora2", "Dora@Example.COM", PASSWORD));
        assertThat(email.getErrorCode()).isEqualTo(AuthErrorCode.EMAIL_TAKEN);

        assertThat(userAccountRepository.count()).isEqualTo(1);
    }

    @Test
    void invalidInputIsRejectedBeforeAnythingIsStored() {
        AuthException weak = assertThrows(AuthException.class,
                () -> authService.register("erin", "erin@example.com", "password"));
        assertThat(weak.getErrorCode()).isEqualTo(AuthErrorCode.WEAK_PASSWORD);
        assertThat(weak.getDetailMessage()).contains("UPPERCASE", "DIGIT", "SYMBOL");

        AuthException username = assertThrows(AuthException.class,
                () -> authService.register("er", "erin@example.com", PASSWORD));
        assertThat(username.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_USERNAME);

        AuthException email = assertThrows(AuthException.class,
                () -> authService.register("erin", "erin@", PASSWORD));
        assertThat(email.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_EMAIL);

        assertThat(userAccountRepository.count()).isZero();
    }

    @Test
    void wrongPasswordAndUnknownIdentifierFailIdentically() {
        UserAccount user = testUserFactory.register("frank");

        AuthException wrong = assertThrows(AuthException.class, () -> authService.login("frank", "Wr0ng!pass"));
        AuthException unknown = assertThrows(AuthException.class, () -> authService.login("nobody", PASSWORD));

        assertThat(wrong.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        assertThat(unknown.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        assertThat(wrong.getDetailMessage()).isEqualTo(unknown.getDetailMessage());

        List<LoginAttempt> frankAttempts = loginAttemptRepository.findByIdentifierNormalizedOrderByAttemptedAtAsc("frank");
        assertThat(frankAttempts).singleElement().satisfies(attempt -> {
            assertThat(attempt.getOutcome()).isEqualTo(LoginOutcome.BAD_CREDENTIALS);
            assertThat(attempt.getUserId()).isEqualTo(user.getId());
        });
        assertThat(loginAttemptRepository.findByIdentifierNormalizedOrderByAttemptedAtAsc("nobody"))
                .extracting(LoginAttempt::getOutcome)
                .containsExactly(LoginOutcome.UNKNOWN_IDENTIFIER);
    }

    @Test
    @DisplayName("five failures lock the identifier even for the correct password until the window passes")
    void lockoutAfterRepeatedFailures() {
        testUserFactory.register("gina");
        for (int i = 0; i < 5; i++) {
            String identifier = i % 2 == 0 ? "gina" : "GINA";
            assertThrows(AuthException.class, () -> authService.login(identifier, "Wr0ng!pass"));
        }

        AuthException locked = assertThrows(AuthException.class, () -> authService.login("gina", PASSWORD));
        assertThat(locked.getErrorCode()).isEqualTo(AuthErrorCode.ACCOUNT_LOCKED);
        assertThat(loginAttemptRepository.findByIdentifierNormalizedOrderByAttemptedAtAsc("gina"))
                .extracting(LoginAttempt::getOutcome)
                .endsWith(LoginOutcome.LOCKED);

        clock.advance(Duration.ofMinutes(15).plusSeconds(1));

        assertDoesNotThrow(() -> authService.login("gina", PASSWORD));
    }

    @Test
    void lockedAttemptsDoNotExtendTheLockout() {
        testUserFactory.register("hank");
        for (int i = 0; i < 5; i++) {
            assertThrows(AuthException.class, () -> authService.login("hank", "Wr0ng!pass"));
        }
        clock.advance(Duration.ofMinutes(10));
        assertThrows(AuthException.class, () -> authService.login("hank", PASSWORD));

        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        assertThat(authService.login("hank", PASSWORD).token()).isNotBlank();
    }

    @Test
    void unknownIdentifiersAreLockedOutToo() {
        for (int i = 0; i < 5; i++) {
            assertThrows(AuthException.class, () -> authService.login("ghost", PASSWORD));
        }

        AuthException locked = assertThrows(AuthException.class, () -> authService.login("ghost", PASSWORD));
        assertThat(locked.getErrorCode()).isEqualTo(AuthErrorCode.ACCOUNT_LOCKED);
    }

    @Test
    void sessionIsValidOneSecondBeforeExpiryAndInvalidAtExpiry() {
        testUserFactory.register("ivan");
        IssuedSession early = authService.login("ivan", PASSWORD);
        IssuedSession late = authService.login("ivan", PASSWORD);

        clock.setInstant(BASE_INSTANT.plus(Duration.ofDays(30)).minusSeconds(1));
        assertDoesNotThrow(() -> authService.validateSession(early.token()));

        clock.setInstant(BASE_INSTANT.plus(Duration.ofDays(30)));
        AuthException expired = assertThrows(AuthException.class, () -> authService.validateSession(late.token()));
        assertThat(expired.getErrorCode()).isEqualTo(AuthErrorCode.SESSION_EXPIRED);
    }

    @Test
    void slidingRenewalNeverPassesTheLifetimeCap() {
        testUserFactory.register("jane");
        IssuedSession session = authService.login("jane", PASSWORD);
        OffsetDateTime issuedAt = OffsetDateTime.ofInstant(BASE_INSTANT, ZoneOffset.UTC);

        clock.setInstant(BASE_INSTANT.plus(Duration.ofDays(29)));
        assertThat(authService.validateSession(session.token()).sessionExpiresAt())
                .isAtSameInstantAs(issuedAt.plusDays(59));

        clock.setInstant(BASE_INSTANT.plus(Duration.ofDays(58)));
        assertThat(authService.validateSession(session.token()).sessionExpiresAt())
                .isAtSameInstantAs(issuedAt.plusDays(88));

        clock.setInstant(BASE_INSTANT.plus(Duration.ofDays(87)));
        assertThat(authService.validateSession(session.token()).sessionExpiresAt())
                .isAtSameInstantAs(issuedAt.plusDays(90));

        clock.setInstant(BASE_INSTANT.plus(Duration.ofDays(90)));
        AuthException expired = assertThrows(AuthException.class, () -> authService.validateSession(session.token()));
        assertThat(expired.getErrorCode()).isEqualTo(AuthErrorCode.SESSION_EXPIRED);
    }

    @Test
    void unknownTokenIsAnInvalidSession() {
        AuthException ex = assertThrows(AuthException.class, () -> authService.validateSession("not-a-real-token"));
        assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_SESSION);
        assertDoesNotThrow(() -> authService.logout("not-a-real-token"));
    }

    @Test
    void changePasswordRevokesEverySessionAndRotatesTheSalt() {
        UserAccount user = testUserFactory.register("kate");
        String oldSalt = userAccountRepository.findById(user.getId()).orElseThrow().getSalt();
        IssuedSession phone = authService.login("kate", PASSWORD);
        IssuedSession laptop = authService.login("kate", PASSWORD);

        authService.changePassword(user.getId(), PASSWORD, "N3w!Secret");

        for (IssuedSession session : List.of(phone, laptop)) {
            AuthException ex = assertThrows(AuthException.class, () -> authService.validateSession(session.token()));
            assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.SESSION_REVOKED);
        }
        assertThat(userAccountRepository.findById(user.getId()).orElseThrow().getSalt()).isNotEqualTo(oldSalt);
        assertThrows(AuthException.class, () -> authService.login("kate", PASSWORD));
        assertThat(authService.login("kate", "N3w!Secret").userId()).isEqualTo(user.getId());
    }

    @Test
    void changePasswordRequiresTheCurrentPasswordAndAStrongReplacement() {
        UserAccount user = testUserFactory.register("liam");
        IssuedSession session = authService.login("liam", PASSWORD);

        AuthException wrongOld = assertThrows(AuthException.class,
                () -> authService.changePassword(user.getId(), "Wr0ng!pass", "N3w!Secret"));
        assertThat(wrongOld.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);

        AuthException weak = assertThrows(AuthException.class,
                () -> authService.changePassword(user.getId(), PASSWORD, "short"));
        assertThat(weak.getErrorCode()).isEqualTo(AuthErrorCode.WEAK_PASSWORD);

        assertDoesNotThrow(() -> authService.validateSession(session.token()));
    }

    @Test
    void disabledUserCannotSignInAndLosesSessions() {
        UserAccount user = testUserFactory.register("mona");
        IssuedSession session = authService.login("mona", PASSWORD);

        authService.disableUser(user.getId());

        AuthException revoked = assertThrows(AuthException.class, () -> authService.validateSession(session.token()));
        assertThat(revoked.getErrorCode()).isEqualTo(AuthErrorCode.SESSION_REVOKED);
        AuthException login = assertThrows(AuthException.class, () -> authService.login("mona", PASSWORD));
        assertThat(login.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        assertThat(loginAttemptRepository.findByIdentifierNormalizedOrderByAttemptedAtAsc("mona"))
                .extracting(LoginAttempt::getOutcome)
                .endsWith(LoginOutcome.DISABLED);
    }

    @Test
    void signOutEverywhereCountsRevokedSessions() {
        UserAccount user = testUserFactory.register("nina");
        authService.login("nina", PASSWORD);
        authService.login("nina", PASSWORD);

        assertThat(authService.signOutEverywhere(user.getId())).isEqualTo(2);
        assertThat(authService.signOutEverywhere(user.getId())).isZero();
    }

    @Test
    void outdatedDigestIsUpgradedOnSuccessfulLogin() {
        UserAccount user = testUserFactory.register("otto");
        String salt = passwordHasher.generateSalt();
        credentialStore.updatePassword(user.getId(), passwordHasher.hash(PASSWORD, salt, 10), salt, 10);

        authService.login("otto", PASSWORD);

        UserAccount stored = userAccountRepository.findById(user.getId()).orElseThrow();
        assertThat(stored.getIterations()).isEqualTo(passwordHasher.defaultIterations());
        assertThat(stored.getSalt()).isNotEqualTo(salt);
        assertThat(authService.login("otto", PASSWORD).userId()).isEqualTo(user.getId());
    }

    @Test
    void concurrentRegistrationsForOneUsernameYieldExactlyOneAccount() throws Exception {
        int contenders = 8;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AuthErrorCode>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String email = "racer" + i + "@example.com";
                Callable<AuthErrorCode> task = () -> {
                    start.await();
                    try {
                        authService.register("racer", email, PASSWORD);
                        return null;
                    } catch (AuthException ex) {
                        return ex.getErrorCode();
                    }
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            int successes = 0;
            List<AuthErrorCode> failures = new ArrayList<>();
            for (Future<AuthErrorCode> result : results) {
                AuthErrorCode code = await(result);
                if (code == null) {
                    successes++;
                } else {
                    failures.add(code);
                }
            }
            assertThat(successes).isEqualTo(1);
            assertThat(failures).hasSize(contenders - 1).containsOnly(AuthErrorCode.USERNAME_TAKEN);
            assertThat(userAccountRepository.count()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("parallel wrong guesses get at most the lockout threshold of password checks")
    void concurrentWrongPasswordsAreCappedByTheLockout() throws Exception {
        testUserFactory.register("pavla");
        int guesses = 30;
        ExecutorService executor = Executors.newFixedThreadPool(guesses);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AuthErrorCode>> results = new ArrayList<>();
        try {
            for (int i = 0; i < guesses; i++) {
                Callable<AuthErrorCode> task = () -> {
                    start.await();
                    try {
                        authService.login("pavla", "Wr0ng!pass");
                        return null;
                    } catch (AuthException ex) {
                        return ex.getErrorCode();
                    }
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            List<AuthErrorCode> codes = new ArrayList<>();
            for (Future<AuthErrorCode> result : results) {
                codes.add(await(result));
            }
            assertThat(codes).filteredOn(code -> code == AuthErrorCode.INVALID_CREDENTIALS).hasSize(5);
            assertThat(codes).filteredOn(code -> code == AuthErrorCode.ACCOUNT_LOCKED).hasSize(guesses - 5);
            assertThat(loginAttemptRepository.findByIdentifierNormalizedOrderByAttemptedAtAsc("pavla"))
                    .filteredOn(attempt -> attempt.getOutcome() == LoginOutcome.BAD_CREDENTIALS)
                    .hasSize(5);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void wrongCurrentPasswordsCountTowardsTheLockout() {
        UserAccount user = testUserFactory.register("quinn");
        for (int i = 0; i < 5; i++) {
            AuthException wrong = assertThrows(AuthException.class,
                    () -> authService.changePassword(user.getId(), "Wr0ng!pass", "N3w!Secret"));
            assertThat(wrong.getErrorCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        }
        assertThat(loginAttemptRepository.findByIdentifierNormalizedOrderByAttemptedAtAsc("quinn"))
                .extracting(LoginAttempt::getOutcome)
                .containsOnly(LoginOutcome.BAD_CREDENTIALS)
                .hasSize(5);

        AuthException locked = assertThrows(AuthException.class,
                () -> authService.changePassword(user.getId(), PASSWORD, "N3w!Secret"));
        assertThat(locked.getErrorCode()).isEqualTo(AuthErrorCode.ACCOUNT_LOCKED);
        AuthException login = assertThrows(AuthException.class, () -> authService.login("quinn", PASSWORD));
        assertThat(login.getErrorCode()).isEqualTo(AuthErrorCode.ACCOUNT_LOCKED);

        clock.advance(Duration.ofMinutes(15).plusSeconds(1));

        assertDoesNotThrow(() -> authService.changePassword(user.getId(), PASSWORD, "N3w!Secret"));
        assertThat(authService.login("quinn", "N3w!Secret").userId()).isEqualTo(user.getId());
    }

    @Test
    void loginAttemptsMustReferenceAnExistingUser() {
        LoginAttempt orphan = new LoginAttempt("ghost", OffsetDateTime.now(clock), LoginOutcome.BAD_CREDENTIALS,
                UUID.randomUUID(), null);

        assertThrows(DataIntegrityViolationException.class, () -> loginAttemptRepository.saveAndFlush(orphan));
    }

    private static AuthErrorCode await(Future<AuthErrorCode> result) throws Exception {
        try {
            return result.get(30, TimeUnit.SECONDS);
        } catch (ExecutionException ex) {
            throw new AssertionError("task failed unexpectedly", ex.getCause());
        }
    }
}
