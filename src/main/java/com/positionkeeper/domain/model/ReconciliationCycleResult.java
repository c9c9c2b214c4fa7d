package com.positionkeeper.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one reconciliation cycle (scheduled or manual).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationCycleResult {

    /** SCHEDULED, MANUAL or STARTUP. */
    private String trigger;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    /** True when the cycle did not run because another was in progress or monitoring is paused. */
    private boolean skipped;

    private int positionsChecked;
    private int positionsClosedRemotely;
    private int fillsInferred;

    /** One entry per credential+market group whose remote calls failed. */
    @Builder.Default
    private List<String> groupErrors = new ArrayList<>();

    public boolean hasErrors() {
        return !groupErrors.isEmpty();
    }
}
