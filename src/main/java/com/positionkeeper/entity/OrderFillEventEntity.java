package com.positionkeeper.entity;

import com.positionkeeper.domain.enums.FillType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the order_fill_events table.
 * Append-only; only the processed flag changes after insert. The unique order_id
 * constraint is the last line of defence against applying one fill twice.
 */
@Entity
@Table(name = "order_fill_events", uniqueConstraints = @UniqueConstraint(columnNames = "order_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderFillEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "position_id", length = 36, nullable = false)
    private String positionId;

    @Column(name = "order_id", length = 64, nullable = false)
    private String orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "fill_type", length = 10, nullable = false)
    private FillType fillType;

    @Column(name = "fill_size")
    private int fillSize;

    @Column(name = "fill_price", precision = 20, scale = 8)
    private BigDecimal fillPrice;

    @Column(name = "filled_at")
    private LocalDateTime filledAt;

    private boolean processed;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;
}
