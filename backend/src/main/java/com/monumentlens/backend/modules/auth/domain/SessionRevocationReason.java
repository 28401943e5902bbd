package com.monumentlens.backend.modules.auth.domain;

public enum SessionRevocationReason {
    LOGOUT,
    PASSWORD_CHANGED,
    PASSWORD_RESET,
    SIGN_OUT_EVERYWHERE,
    USER_DISABLED
}
