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
public class RemoteConditionalOrder {

    private String id;
    private String symbol;
    private BigDecimal triggerPrice;
}
