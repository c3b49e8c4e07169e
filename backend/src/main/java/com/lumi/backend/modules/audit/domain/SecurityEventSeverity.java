package com.lumi.backend.modules.audit.domain;

public enum SecurityEventSeverity {
    INFO,
    WARNING,
    CRITICAL
}
