package com.positionkeeper.domain.enums;

public enum FillType {
    TP1,
    TP2,
    SL,
    /** Size reduced outside the protective orders, reported by an operator. */
    MANUAL
}
