package com.positionkeeper.expiry;

import com.positionkeeper.core.PositionLockRegistry;
import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.enums.TrackingStatus;
import com.positionkeeper.domain.model.LifecycleSettings;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.TimeTracking;
import com.positionkeeper.domain.model.TimeTrackingView;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.exception.BusinessException;
import com.positionkeeper.exchange.PlacedOrder;
import com.positionkeeper.observability.MonitoringHealth;
import com.positionkeeper.oms.FillProcessor;
import com.positionkeeper.oms.ProtectiveOrderManager;
import com.positionkeeper.service.AuditService;
import com.positionkeeper.store.PositionStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Enforces the maximum age of positions, independently of fill reconciliation.
 *
 * <p>Each sweep walks the ACTIVE and WARNED time tracking rows, soonest expiry first:
 * <ul>
 *   <li>at or after expiry: force close if never attempted, otherwise mark EXPIRED</li>
 *   <li>within the force-close window: cancel protective orders, phase COMPLETED, status FORCE_CLOSED</li>
 *   <li>within the warning window: set the warning flag once</li>
 * </ul>
 *
 * <p>The attempt flag is written before any remote call. A force close that fails is audited and
 * left for the operator; the sweep does not try it again.
 */
@Service
public class TimeExpiryEnforcer {

    private static final Logger log = LoggerFactory.getLogger(TimeExpiryEnforcer.class);

    private final PositionStore positionStore;
    private final ProtectiveOrderManager protectiveOrderManager;
    private final PositionLockRegistry positionLockRegistry;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final MonitoringHealth monitoringHealth;
    private final LifecycleSettings lifecycleSettings;

    private final AtomicBoolean sweepRunning = new AtomicBoolean(false);

    public TimeExpiryEnforcer(
            PositionStore positionStore,
            ProtectiveOrderManager protectiveOrderManager,
            PositionLockRegistry positionLockRegistry,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            MonitoringHealth monitoringHealth,
            LifecycleSettings lifecycleSettings) {
        this.positionStore = positionStore;
        this.protectiveOrderManager = protectiveOrderManager;
        this.positionLockRegistry = positionLockRegistry;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.monitoringHealth = monitoringHealth;
        this.lifecycleSettings = lifecycleSettings;
    }

    @Scheduled(
            fixedDelayString = "${positionkeeper.expiry.sweep-interval-ms:900000}",
            initialDelayString = "${positionkeeper.expiry.sweep-interval-ms:900000}")
    public void scheduledSweep() {
        sweep(LocalDateTime.now());
    }

    /**
     * Testable version: sweeps as if the clock read {@code now}.
     */
    public ExpirySweepResult sweep(LocalDateTime now) {
        if (!sweepRunning.compareAndSet(false, true)) {
            log.debug("Expiry sweep already in progress, skipping");
            return ExpirySweepResult.builder().sweptAt(now).skipped(true).build();
        }

        ExpirySweepResult result = ExpirySweepResult.builder().sweptAt(now).build();
        try {
            List<TimeTracking> open = positionStore.listOpenTracking();
            result.setChecked(open.size());
            for (TimeTracking tracking : open) {
                try {
                    checkPosition(tracking, now, result);
                } catch (RuntimeException e) {
                    monitoringHealth.recordError(ErrorSeverity.ERROR, tracking.getPositionId(), "Expiry check failed: " + e.getMessage());
                    log.error("Expiry check failed for position {}", tracking.getPositionId(), e);
                }
            }
            result.setPurged(purgeClosedTracking(now));
        } finally {
            sweepRunning.set(false);
        }

        if (result.getWarned() + result.getForceClosed() + result.getForceCloseFailed() + result.getExpired() > 0) {
            log.info(
                    "Expiry sweep: checked={}, warned={}, forceClosed={}, forceCloseFailed={}, expired={}",
                    result.getChecked(),
                    result.getWarned(),
                    result.getForceClosed(),
                    result.getForceCloseFailed(),
                    result.getExpired());
        }
        return result;
    }

    private void checkPosition(TimeTracking tracking, LocalDateTime now, ExpirySweepResult result) {
        String positionId = tracking.getPositionId();
        Optional<Position> position = positionStore.get(positionId);
        if (position.isEmpty() || position.get().getPhase().isTerminal()) {
            // Closed by a fill or by reconciliation; the time box has nothing left to guard
            positionStore.updateTrackingStatus(positionId, TrackingStatus.EXPIRED, now);
            return;
        }

        long minutesToExpiry = tracking.minutesToExpiry(now);
        boolean expired = !now.isBefore(tracking.getExpiresAt());
        boolean forceCloseDue = lifecycleSettings.isForceCloseEnabled()
                && !tracking.isForceCloseAttempted()
                && minutesToExpiry <= lifecycleSettings.getForceCloseBeforeExpiryMinutes();

        if (forceCloseDue) {
            String reason = expired ? "time box expired" : "time box expiring";
            Optional<Boolean> closed = forceClose(positionId, reason, now);
            if (closed.isEmpty()) {
                log.debug("Position {} is locked, force close deferred to next sweep", positionId);
            } else if (closed.get()) {
                result.setForceClosed(result.getForceClosed() + 1);
            } else {
                result.setForceCloseFailed(result.getForceCloseFailed() + 1);
            }
        } else if (expired) {
            markExpired(position.get(), tracking, now);
            result.setExpired(result.getExpired() + 1);
        } else if (!tracking.isWarningSent() && minutesToExpiry <= lifecycleSettings.getWarningBeforeExpiryMinutes()) {
            if (sendWarning(position.get(), tracking, minutesToExpiry, now)) {
                result.setWarned(result.getWarned() + 1);
            }
        }
    }

    private boolean sendWarning(Position position, TimeTracking tracking, long minutesToExpiry, LocalDateTime now) {
        if (!positionStore.markWarningSent(position.getId(), now)) {
            return false;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", position.getSymbol());
        details.put("minutesToExpiry", minutesToExpiry);
        details.put("expiresAt", tracking.getExpiresAt().toString());
        auditService.success(position.getId(), AuditAction.EXPIRY_WARNING, details);
        eventPublisherHelper.publishExpiryWarning(this, position, details);
        log.warn("Position {} ({}) expires in {} minutes", position.getId(), position.getSymbol(), minutesToExpiry);
        return true;
    }

    private void markExpired(Position position, TimeTracking tracking, LocalDateTime now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", position.getSymbol());
        details.put("expiresAt", tracking.getExpiresAt().toString());
        details.put("forceCloseAttempted", tracking.isForceCloseAttempted());
        details.put("remainingSize", position.getRemainingSize());
        auditService.success(position.getId(), AuditAction.POSITION_EXPIRED, details);
        positionStore.updateTrackingStatus(position.getId(), TrackingStatus.EXPIRED, now);
        log.warn(
                "Position {} ({}) passed its expiry while still open with {} contracts",
                position.getId(),
                position.getSymbol(),
                position.getRemainingSize());
    }

    /**
     * Force closes a position now, holding its lock.
     *
     * @return empty when another mutation holds the position, otherwise whether the close succeeded
     */
    public Optional<Boolean> forceClose(String positionId, String reason, LocalDateTime now) {
        return positionLockRegistry.withLock(positionId, () -> executeForceClose(positionId, reason, now));
    }

    private boolean executeForceClose(String positionId, String reason, LocalDateTime now) {
        Position position = positionStore.getOrThrow(positionId);
        if (position.getPhase().isTerminal()) {
            log.info("Position {} already {}, nothing to force close", positionId, position.getPhase());
            return false;
        }

        // Written before any remote call so a crash mid-close is not retried automatically
        positionStore.markForceCloseAttempted(positionId, now);
        log.warn("Force closing position {} ({}): {}", positionId, position.getSymbol(), reason);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", position.getSymbol());
        details.put("reason", reason);
        details.put("remainingSize", position.getRemainingSize());
        try {
            ProtectiveOrderManager.CancellationResult cancellation = protectiveOrderManager.cancelProtectiveOrders(position);
            details.put("cancelledOrders", cancellation.getCancelledOrderIds());
            details.put("failedCancels", cancellation.getFailedOrderIds());

            BigDecimal pnl = null;
            if (lifecycleSettings.isFlattenOnForceClose()) {
                PlacedOrder flatten = protectiveOrderManager.flatten(position);
                details.put("flattenOrderId", flatten.getOrderId());
                if (flatten.getAverageFillPrice() != null) {
                    pnl = FillProcessor.realizedPnl(position, flatten.getAverageFillPrice(), position.getRemainingSize());
                }
            }

            details.put("realizedPnl", pnl);
            auditService.success(positionId, AuditAction.FORCE_CLOSE_EXECUTED, details);
            Position closed = positionStore.applyPhaseTransition(positionId, PositionPhase.COMPLETED, 0, pnl, "force closed: " + reason);
            positionStore.updateTrackingStatus(positionId, TrackingStatus.FORCE_CLOSED, now);
            eventPublisherHelper.publishForceClosed(this, closed, details);
            log.info(
                    "Position {} force closed: cancelled {} orders, {} failed",
                    positionId,
                    cancellation.getCancelledOrderIds().size(),
                    cancellation.getFailedOrderIds().size());
            return true;
        } catch (RuntimeException e) {
            auditService.failure(positionId, AuditAction.FORCE_CLOSE_FAILED, details, e.getMessage());
            monitoringHealth.recordError(ErrorSeverity.ERROR, positionId, "Force close failed: " + e.getMessage());
            log.error("Force close of position {} failed, not retried automatically", positionId, e);
            return false;
        }
    }

    /**
     * Pushes the expiry back by {@code hours} and starts a fresh time box.
     *
     * @return false when the position has no open time box
     */
    public boolean extendExpiry(String positionId, int hours, LocalDateTime now) {
        if (hours <= 0) {
            throw new BusinessException("Extension must be a positive number of hours", Map.of("hours", hours));
        }
        Optional<TimeTracking> before = positionStore.getTracking(positionId);
        boolean extended = positionStore.extendExpiry(positionId, hours, now);
        if (!extended) {
            log.warn("Cannot extend expiry of position {}: no open time box", positionId);
            return false;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("additionalHours", hours);
        before.ifPresent(tracking -> {
            details.put("previousExpiry", tracking.getExpiresAt().toString());
            details.put("newExpiry", tracking.getExpiresAt().plusHours(hours).toString());
        });
        auditService.success(positionId, AuditAction.EXPIRY_EXTENDED, details);
        return true;
    }

    /** Open time boxes with minutes to expiry, soonest first. */
    public List<TimeTrackingView> getTimeTrackingStatus(LocalDateTime now) {
        return positionStore.listOpenTracking().stream()
                .map(tracking -> TimeTrackingView.builder()
                        .positionId(tracking.getPositionId())
                        .symbol(positionStore
                                .get(tracking.getPositionId())
                                .map(Position::getSymbol)
                                .orElse(null))
                        .expiresAt(tracking.getExpiresAt())
                        .minutesToExpiry(tracking.minutesToExpiry(now))
                        .status(tracking.getStatus())
                        .warningSent(tracking.isWarningSent())
                        .forceCloseAttempted(tracking.isForceCloseAttempted())
                        .build())
                .toList();
    }

    /** Deletes EXPIRED and FORCE_CLOSED rows past the retention window. */
    public int purgeClosedTracking(LocalDateTime now) {
        int purged = positionStore.purgeClosedTracking(now.minusHours(lifecycleSettings.getTrackingRetentionHours()));
        if (purged > 0) {
            log.info("Purged {} closed time tracking rows", purged);
        }
        return purged;
    }
}
