package com.positionkeeper.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunables for stop migration and time boxing. Built from {@code positionkeeper.*} properties
 * by {@code LifecycleConfig}; tests build it directly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleSettings {

    /** Fractional offset from entry for the break-even stop (0.0005 = 5 bps). */
    @Builder.Default
    private BigDecimal breakEvenBuffer = new BigDecimal("0.0005");

    /** Fractional distance of the trailing stop from the tp2 fill price. */
    @Builder.Default
    private BigDecimal trailingDistance = new BigDecimal("0.01");

    /** Trigger prices are rounded to a multiple of this. */
    @Builder.Default
    private BigDecimal tickSize = new BigDecimal("0.1");

    @Builder.Default
    private long orderExpirySeconds = 86_400;

    @Builder.Default
    private int maxPositionAgeHours = 4;

    @Builder.Default
    private int warningBeforeExpiryMinutes = 30;

    @Builder.Default
    private int forceCloseBeforeExpiryMinutes = 5;

    @Builder.Default
    private boolean forceCloseEnabled = true;

    /** Also send a reduce-only market order for the remaining size when force closing. */
    @Builder.Default
    private boolean flattenOnForceClose = false;

    @Builder.Default
    private int trackingRetentionHours = 24;
}
