package com.monumentlens.backend.modules.auth.application;

/**
 * Raised by {@link CredentialStore} when a write hits the username or email uniqueness constraint.
 */
public class DuplicateCredentialException extends RuntimeException {

    public enum Field {
        USERNAME,
        EMAIL
    }

    private final Field field;

    public DuplicateCredentialException(Field field, Throwable cause) {
        super("Duplicate " + field.name().toLowerCase(), cause);
        this.field = field;
    }

    public Field getField() {
        return field;
    }
}
