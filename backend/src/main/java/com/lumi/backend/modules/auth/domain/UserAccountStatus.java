package com.lumi.backend.modules.auth.domain;

public enum UserAccountStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED
}
