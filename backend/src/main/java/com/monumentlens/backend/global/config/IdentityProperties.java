package com.monumentlens.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for credentials, sessions, lockout and password reset, bound from {@code app.identity.*}.
 */
@ConfigurationProperties(prefix = "app.identity")
public class IdentityProperties {

    private final Password password = new Password();
    private final Session session = new Session();
    private final Lockout lockout = new Lockout();
    private final Reset reset = new Reset();

    public Password getPassword() {
        return password;
    }

    public Session getSession() {
        return session;
    }

    public Lockout getLockout() {
        return lockout;
    }

    public Reset getReset() {
        return reset;
    }

    public static class Password {

        /** PBKDF2 iteration count for newly written digests. */
        private int iterations = 100_000;

        private int saltBytes = 16;

        public int getIterations() {
            return iterations;
        }

        public void setIterations(int iterations) {
            this.iterations = iterations;
        }

        public int getSaltBytes() {
            return saltBytes;
        }

        public void setSaltBytes(int saltBytes) {
            this.saltBytes = saltBytes;
        }
    }

    public static class Session {

        private Duration ttl = Duration.ofDays(30);

        /** Hard cap measured from issuance; sliding renewal never passes it. */
        private Duration maxLifetime = Duration.ofDays(90);

        private boolean slidingExpiration = true;

        private int tokenBytes = 32;

        private boolean sweepEnabled = true;

        private Duration sweepInterval = Duration.ofHours(1);

        private int sweepBatchSize = 500;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getMaxLifetime() {
            return maxLifetime;
        }

        public void setMaxLifetime(Duration maxLifetime) {
            this.maxLifetime = maxLifetime;
        }

        public boolean isSlidingExpiration() {
            return slidingExpiration;
        }

        public void setSlidingExpiration(boolean slidingExpiration) {
            this.slidingExpiration = slidingExpiration;
        }

        public int getTokenBytes() {
            return tokenBytes;
        }

        public void setTokenBytes(int tokenBytes) {
            this.tokenBytes = tokenBytes;
        }

        public boolean isSweepEnabled() {
            return sweepEnabled;
        }

        public void setSweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public int getSweepBatchSize() {
            return sweepBatchSize;
        }

        public void setSweepBatchSize(int sweepBatchSize) {
            this.sweepBatchSize = sweepBatchSize;
        }
    }

    public static class Lockout {

        private int maxFailures = 5;

        private Duration window = Duration.ofMinutes(15);

        public int getMaxFailures() {
            return maxFailures;
        }

        public void setMaxFailures(int maxFailures) {
            this.maxFailures = maxFailures;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class Reset {

        private Duration ttl = Duration.ofHours(1);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }
}
