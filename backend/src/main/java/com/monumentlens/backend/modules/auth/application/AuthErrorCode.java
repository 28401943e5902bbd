package com.monumentlens.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Structured failure codes crossing the auth boundary. Credential and session codes share a generic
 * detail so the wording never reveals which check failed.
 */
public enum AuthErrorCode {

    INVALID_USERNAME(Category.VALIDATION, HttpStatus.UNPROCESSABLE_ENTITY, "Username is not acceptable"),
    INVALID_EMAIL(Category.VALIDATION, HttpStatus.UNPROCESSABLE_ENTITY, "Email is not acceptable"),
    INVALID_FULL_NAME(Category.VALIDATION, HttpStatus.UNPROCESSABLE_ENTITY, "Full name is not acceptable"),
    WEAK_PASSWORD(Category.VALIDATION, HttpStatus.UNPROCESSABLE_ENTITY, "Password does not meet the strength rules"),
    RESET_TOKEN_INVALID(Category.VALIDATION, HttpStatus.BAD_REQUEST, "Reset token is invalid or expired"),

    USERNAME_TAKEN(Category.CONFLICT, HttpStatus.CONFLICT, "Username is already registered"),
    EMAIL_TAKEN(Category.CONFLICT, HttpStatus.CONFLICT, "Email is already registered"),

    INVALID_CREDENTIALS(Category.CREDENTIALS, HttpStatus.UNAUTHORIZED, "Authentication failed"),
    ACCOUNT_LOCKED(Category.CREDENTIALS, HttpStatus.LOCKED, "Authentication failed"),

    INVALID_SESSION(Category.SESSION, HttpStatus.UNAUTHORIZED, "Session is not valid"),
    SESSION_EXPIRED(Category.SESSION, HttpStatus.UNAUTHORIZED, "Session is not valid"),
    SESSION_REVOKED(Category.SESSION, HttpStatus.UNAUTHORIZED, "Session is not valid"),

    USER_NOT_FOUND(Category.NOT_FOUND, HttpStatus.NOT_FOUND, "User not found"),

    UNAVAILABLE(Category.UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, "Identity store is temporarily unavailable");

    public enum Category {
        VALIDATION,
        CONFLICT,
        CREDENTIALS,
        SESSION,
        NOT_FOUND,
        UNAVAILABLE
    }

    private final Category category;
    private final HttpStatus status;
    private final String defaultDetail;

    AuthErrorCode(Category category, HttpStatus status, String defaultDetail) {
        this.category = category;
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    public Category getCategory() {
        return category;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }

    public boolean isRetryable() {
        return category == Category.UNAVAILABLE;
    }
}
