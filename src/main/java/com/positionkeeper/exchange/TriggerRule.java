package com.positionkeeper.exchange;

/** Direction in which the mark price must cross the trigger price. */
public enum TriggerRule {
    /** Fires when price falls to or below the trigger: long stops, short take-profits. */
    LESS_OR_EQUAL,
    /** Fires when price rises to or above the trigger: short stops, long take-profits. */
    GREATER_OR_EQUAL
}
