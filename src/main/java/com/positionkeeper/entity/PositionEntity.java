package com.positionkeeper.entity;

import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.enums.PositionPhase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the position_states table. One row per opened position, never deleted;
 * closed positions stay in a terminal phase.
 */
@Entity
@Table(
        name = "position_states",
        indexes = {
            @Index(name = "idx_position_states_phase", columnList = "phase"),
            @Index(name = "idx_position_states_scope", columnList = "credential_id, market, symbol")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 50, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private Direction direction;

    @Column(name = "original_size")
    private int originalSize;

    @Column(name = "entry_price", precision = 20, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "entry_order_id", length = 64)
    private String entryOrderId;

    @Column(name = "tp1_size")
    private int tp1Size;

    @Column(name = "tp2_size")
    private int tp2Size;

    @Column(name = "runner_size")
    private int runnerSize;

    @Column(name = "tp1_order_id", length = 64)
    private String tp1OrderId;

    @Column(name = "tp2_order_id", length = 64)
    private String tp2OrderId;

    @Column(name = "stop_order_id", length = 64)
    private String stopOrderId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private PositionPhase phase;

    @Column(name = "remaining_size")
    private int remainingSize;

    @Column(name = "realized_pnl", precision = 20, scale = 8)
    private BigDecimal realizedPnl;

    @Column(name = "original_stop_price", precision = 20, scale = 8)
    private BigDecimal originalStopPrice;

    @Column(name = "current_stop_price", precision = 20, scale = 8)
    private BigDecimal currentStopPrice;

    @Column(name = "tp1_price", precision = 20, scale = 8)
    private BigDecimal tp1Price;

    @Column(name = "tp2_price", precision = 20, scale = 8)
    private BigDecimal tp2Price;

    @Column(name = "credential_id", length = 64, nullable = false)
    private String credentialId;

    @Column(length = 20, nullable = false)
    private String market;

    @Column(name = "close_reason", length = 100)
    private String closeReason;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
