package com.positionkeeper.domain.enums;

public enum ErrorSeverity {
    WARNING,
    ERROR,
    /** Reserved for capital left without any protective order. */
    CRITICAL
}
