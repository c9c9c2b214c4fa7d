package com.positionkeeper.repository.jpa;

import com.positionkeeper.domain.enums.TrackingStatus;
import com.positionkeeper.entity.TimeTrackingEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the position_time_tracking table.
 * Flag updates are conditional so that a flag is only ever set once.
 */
@Repository
public interface TimeTrackingJpaRepository extends JpaRepository<TimeTrackingEntity, String> {

    List<TimeTrackingEntity> findByStatusInOrderByExpiresAtAsc(Collection<TrackingStatus> statuses);

    @Modifying
    @Transactional
    @Query("UPDATE TimeTrackingEntity t SET t.warningSent = true, t.status = :warned, t.updatedAt = :now"
            + " WHERE t.positionId = :positionId AND t.warningSent = false")
    int markWarningSent(
            @Param("positionId") String positionId,
            @Param("warned") TrackingStatus warned,
            @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("UPDATE TimeTrackingEntity t SET t.forceCloseAttempted = true, t.updatedAt = :now"
            + " WHERE t.positionId = :positionId AND t.forceCloseAttempted = false")
    int markForceCloseAttempted(@Param("positionId") String positionId, @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("UPDATE TimeTrackingEntity t SET t.status = :status, t.updatedAt = :now WHERE t.positionId = :positionId")
    int updateStatus(
            @Param("positionId") String positionId,
            @Param("status") TrackingStatus status,
            @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("DELETE FROM TimeTrackingEntity t WHERE t.status IN :statuses AND t.expiresAt < :cutoff")
    int deleteClosedBefore(
            @Param("statuses") Collection<TrackingStatus> statuses, @Param("cutoff") LocalDateTime cutoff);
}
