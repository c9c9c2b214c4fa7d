package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.TrackingStatus;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeTrackingView {

    private String positionId;
    private String symbol;
    private LocalDateTime expiresAt;
    private long minutesToExpiry;
    private TrackingStatus status;
    private boolean warningSent;
    private boolean forceCloseAttempted;
}
