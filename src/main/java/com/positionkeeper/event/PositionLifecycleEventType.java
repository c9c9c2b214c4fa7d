package com.positionkeeper.event;

/**
 * Types of position lifecycle events.
 */
public enum PositionLifecycleEventType {
    /** Entry and the full protective set are in place. */
    OPENED,
    /** Protective set failed and was replaced by a lone emergency stop. */
    EMERGENCY_PROTECTION,
    /** Entry filled but no stop could be placed. Needs an operator. */
    UNPROTECTED,
    /** An inferred or reported fill changed the position. */
    FILL_APPLIED,
    /** Stop moved (break-even or trailing). */
    STOP_REPLACED,
    /** Exchange no longer reports the position. */
    CLOSED_REMOTELY,
    /** Expiry warning threshold crossed. */
    EXPIRY_WARNING,
    /** Protective orders cancelled and position completed by time box or operator. */
    FORCE_CLOSED
}
