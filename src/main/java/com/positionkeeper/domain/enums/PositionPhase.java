package com.positionkeeper.domain.enums;

/**
 * Lifecycle phase of a managed position.
 *
 * <p>Phases only move forward: {@code INITIAL -> TP1_FILLED -> TP2_FILLED}, and either
 * terminal phase may be reached from any non-terminal one.
 */
public enum PositionPhase {
    /** Entry filled, full protective set (tp1, tp2, stop) working. */
    INITIAL,
    /** First take-profit tier filled, stop moved to break-even. */
    TP1_FILLED,
    /** Second tier filled, stop trailing. Only the runner remains. */
    TP2_FILLED,
    /** Closed without a stop fill: remote close, expiry, manual flattening. */
    COMPLETED,
    /** Stop order filled. */
    STOPPED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED_OUT;
    }

    public boolean canTransitionTo(PositionPhase target) {
        if (isTerminal()) {
            return false;
        }
        if (target.isTerminal()) {
            return true;
        }
        return target.ordinal() > ordinal();
    }
}
