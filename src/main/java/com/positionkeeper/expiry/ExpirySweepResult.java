package com.positionkeeper.expiry;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts of what one expiry sweep did.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpirySweepResult {

    private LocalDateTime sweptAt;
    private boolean skipped;
    private int checked;
    private int warned;
    private int forceClosed;
    private int forceCloseFailed;
    private int expired;
    private int purged;
}
