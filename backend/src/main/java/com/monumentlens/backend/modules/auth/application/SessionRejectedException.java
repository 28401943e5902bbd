package com.monumentlens.backend.modules.auth.application;

public class SessionRejectedException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        EXPIRED,
        REVOKED
    }

    private final Reason reason;

    public SessionRejectedException(Reason reason) {
        super("Session rejected: " + reason);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
