package com.positionkeeper.exchange;

import com.positionkeeper.domain.enums.Direction;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A reduce-only price-triggered order protecting (or taking profit on) a position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConditionalOrderSpec {

    private String symbol;

    /** Direction of the position this order reduces. */
    private Direction positionDirection;

    private BigDecimal triggerPrice;
    private TriggerRule triggerRule;

    /** Contracts to close. Ignored when {@code closeAll} is set. */
    private int size;

    /** Close whatever size is open when triggered. Used for stops. */
    private boolean closeAll;

    @Builder.Default
    private boolean reduceOnly = true;

    private long expirationSeconds;

    /** TP1, TP2, SL or EMERGENCY_SL. Carried as the order text for traceability. */
    private String label;
}
