package com.positionkeeper.oms;

public enum FillOutcome {
    /** The fill changed the position. */
    APPLIED,
    /** The order id was already recorded or processed. */
    DUPLICATE,
    /** Recorded and marked processed without effect (wrong phase or closed position). */
    IGNORED
}
