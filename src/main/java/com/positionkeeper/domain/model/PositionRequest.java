package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.Direction;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Upstream request to open a position. The levels (tiers, targets, stop) arrive fully computed;
 * {@code entryPrice} is the reference price used when the exchange does not report an average
 * fill price for the market entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionRequest {

    private String symbol;
    private Direction direction;
    private int size;
    private BigDecimal entryPrice;

    private int tp1Size;
    private int tp2Size;
    private BigDecimal tp1Price;
    private BigDecimal tp2Price;
    private BigDecimal stopPrice;

    private String credentialId;
    private String market;

    public ExchangeScope scope() {
        return ExchangeScope.of(credentialId, market);
    }
}
