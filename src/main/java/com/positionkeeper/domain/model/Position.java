package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.enums.PositionPhase;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A managed position: the entry plus the protective orders guarding it.
 *
 * <p>Sizes are contract counts. {@code tp1Size + tp2Size + runnerSize == originalSize};
 * the runner is whatever is left after both tiers and is only closed by the stop.
 *
 * <p>While the phase is non-terminal, {@code stopOrderId} is always set and
 * {@code remainingSize > 0}. Terminal positions have {@code remainingSize == 0}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String symbol;
    private Direction direction;

    private int originalSize;
    private BigDecimal entryPrice;
    private String entryOrderId;

    private int tp1Size;
    private int tp2Size;
    private int runnerSize;

    private String tp1OrderId;
    private String tp2OrderId;
    private String stopOrderId;

    private PositionPhase phase;
    private int remainingSize;
    private BigDecimal realizedPnl;

    private BigDecimal originalStopPrice;
    private BigDecimal currentStopPrice;
    private BigDecimal tp1Price;
    private BigDecimal tp2Price;

    private String credentialId;
    private String market;

    /** Why the position reached a terminal phase. Null while open. */
    private String closeReason;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public ExchangeScope scope() {
        return ExchangeScope.of(credentialId, market);
    }
}
