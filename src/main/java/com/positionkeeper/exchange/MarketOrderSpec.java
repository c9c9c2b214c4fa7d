package com.positionkeeper.exchange;

import com.positionkeeper.domain.enums.Direction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Immediate-or-cancel market order. {@code direction} is the side of the resulting exposure:
 * LONG buys, SHORT sells. A reduce-only order with the opposite direction flattens.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketOrderSpec {

    private String symbol;
    private Direction direction;
    private int size;
    private boolean reduceOnly;
}
