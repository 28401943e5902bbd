package com.monumentlens.backend.modules.auth.application;

import java.util.UUID;

public class UnknownUserException extends RuntimeException {

    private final UUID userId;

    public UnknownUserException(UUID userId) {
        super("No user with id " + userId);
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }
}
