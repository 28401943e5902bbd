package com.monumentlens.backend.modules.auth.domain;

public enum UserStatus {
    ACTIVE,
    DISABLED
}
