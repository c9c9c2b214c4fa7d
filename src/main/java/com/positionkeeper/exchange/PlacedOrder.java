package com.positionkeeper.exchange;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlacedOrder {

    private String orderId;

    /** Average fill price when the exchange reports one, otherwise null. */
    private BigDecimal averageFillPrice;
}
