package com.monumentlens.backend.modules.auth.application;

import com.monumentlens.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthErrorCode errorCode;

    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, null);
    }

    public AuthException(AuthErrorCode errorCode, String detail) {
        super(errorCode.getStatus(), errorCode.name(), detail != null ? detail : errorCode.getDefaultDetail());
        this.errorCode = errorCode;
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }
}
