package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.FillType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An inferred (or operator-reported) fill. Unique per order id; the order id is the
 * idempotency key for fill processing.
 *
 * <p>Size and price are approximations: size is the configured tier size and price is the
 * trigger price last seen on the order, since the exchange reports neither for a vanished order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderFillEvent {

    private Long id;
    private String positionId;
    private String orderId;
    private FillType fillType;
    private int fillSize;
    private BigDecimal fillPrice;
    private LocalDateTime filledAt;
    private boolean processed;
    private LocalDateTime processedAt;
}
