package com.monumentlens.backend.modules.auth.domain;

import java.util.EnumSet;
import java.util.Set;

public enum LoginOutcome {
    SUCCESS,
    BAD_CREDENTIALS,
    UNKNOWN_IDENTIFIER,
    LOCKED,
    DISABLED;

    /** Outcomes that count toward a lockout. */
    public static final Set<LoginOutcome> FAILURES = EnumSet.of(BAD_CREDENTIALS, UNKNOWN_IDENTIFIER);
}
