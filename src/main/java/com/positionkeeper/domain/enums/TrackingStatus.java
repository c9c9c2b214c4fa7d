package com.positionkeeper.domain.enums;

public enum TrackingStatus {
    ACTIVE,
    WARNED,
    EXPIRED,
    FORCE_CLOSED;

    public boolean isOpen() {
        return this == ACTIVE || this == WARNED;
    }
}
