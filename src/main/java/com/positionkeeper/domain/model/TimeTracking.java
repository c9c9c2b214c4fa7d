package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.TrackingStatus;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Time box for one position. Created together with the position, mutated only by the
 * expiry enforcer and by explicit expiry extensions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeTracking {

    private String positionId;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
    private boolean warningSent;
    private boolean forceCloseAttempted;
    private TrackingStatus status;
    private LocalDateTime updatedAt;

    /** Whole minutes until expiry, negative once expired. */
    public long minutesToExpiry(LocalDateTime now) {
        return Duration.between(now, expiresAt).toMinutes();
    }
}
