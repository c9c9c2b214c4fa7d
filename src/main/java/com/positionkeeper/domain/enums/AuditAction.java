package com.positionkeeper.domain.enums;

/**
 * Every mutation attempt recorded in the action audit trail.
 */
public enum AuditAction {
    POSITION_CREATED,
    POSITION_OPEN_FAILED,
    PROTECTION_ROLLBACK,
    EMERGENCY_STOP_PLACED,
    STOP_ONLY_PROTECTION,
    UNPROTECTED_POSITION,
    TP1_FILLED,
    TP2_FILLED,
    SL_FILLED,
    MANUAL_FILLED,
    FILL_IGNORED,
    SL_UPDATED_BREAK_EVEN,
    SL_UPDATED_TRAILING,
    STALE_STOP_CANCEL_FAILED,
    POSITION_STOPPED_OUT,
    POSITION_COMPLETED,
    POSITION_AUTO_COMPLETED,
    EXPIRY_WARNING,
    POSITION_EXPIRED,
    EXPIRY_EXTENDED,
    FORCE_CLOSE_EXECUTED,
    FORCE_CLOSE_FAILED,
    ORPHAN_ORDER_CANCELLED,
    ERROR_OCCURRED
}
