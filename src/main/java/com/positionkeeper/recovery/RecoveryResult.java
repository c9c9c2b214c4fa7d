package com.positionkeeper.recovery;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    // Step 1: fills recorded but never applied
    private int unprocessedFillsFound;
    private int fillsResumed;

    @Builder.Default
    private List<String> failedFillOrderIds = new ArrayList<>();

    // Step 2: positions to keep watching
    private long activePositions;
    private int emergencyProtectedPositions;

    // Step 3: first reconciliation cycle
    private int positionsClosedWhileDown;
    private boolean reconciliationFailed;
}
