package com.positionkeeper.entity;

import com.positionkeeper.domain.enums.TrackingStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the position_time_tracking table, keyed by position id.
 */
@Entity
@Table(name = "position_time_tracking")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeTrackingEntity {

    @Id
    @Column(name = "position_id", length = 36)
    private String positionId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "warning_sent")
    private boolean warningSent;

    @Column(name = "force_close_attempted")
    private boolean forceCloseAttempted;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private TrackingStatus status;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
