package com.positionkeeper.domain.enums;

public enum AuditOutcome {
    SUCCESS,
    FAILURE
}
