package com.positionkeeper.domain.enums;

import java.math.BigDecimal;

public enum Direction {
    LONG,
    SHORT;

    /** +1 for long, -1 for short. Multiplies price deltas into PnL. */
    public BigDecimal sign() {
        return this == LONG ? BigDecimal.ONE : BigDecimal.ONE.negate();
    }
}
