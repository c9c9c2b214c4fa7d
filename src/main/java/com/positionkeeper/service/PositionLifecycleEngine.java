package com.positionkeeper.service;

import com.positionkeeper.core.PositionLockRegistry;
import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.enums.FillType;
import com.positionkeeper.domain.model.EngineStatus;
import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.domain.model.MonitoringError;
import com.positionkeeper.domain.model.OrderFillEvent;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.PositionDetails;
import com.positionkeeper.domain.model.PositionRequest;
import com.positionkeeper.domain.model.ReconciliationCycleResult;
import com.positionkeeper.domain.model.TimeTrackingView;
import com.positionkeeper.exception.BusinessException;
import com.positionkeeper.expiry.TimeExpiryEnforcer;
import com.positionkeeper.observability.MonitoringHealth;
import com.positionkeeper.oms.FillOutcome;
import com.positionkeeper.oms.FillProcessor;
import com.positionkeeper.oms.PositionOpeningExecutor;
import com.positionkeeper.reconciliation.FillReconciliationService;
import com.positionkeeper.reconciliation.OrphanCleanupResult;
import com.positionkeeper.reconciliation.OrphanedOrderCleanupService;
import com.positionkeeper.store.PositionStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for every operator-facing operation on managed positions.
 *
 * <p>Mutations of a single position take the position lock shared with the reconciliation
 * loop and the expiry sweep. A position that is busy is rejected with CONFLICT instead of
 * waiting.
 */
@Service
public class PositionLifecycleEngine {

    private static final Logger log = LoggerFactory.getLogger(PositionLifecycleEngine.class);

    private final PositionOpeningExecutor positionOpeningExecutor;
    private final PositionStore positionStore;
    private final FillProcessor fillProcessor;
    private final FillReconciliationService fillReconciliationService;
    private final OrphanedOrderCleanupService orphanedOrderCleanupService;
    private final TimeExpiryEnforcer timeExpiryEnforcer;
    private final PositionLockRegistry positionLockRegistry;
    private final AuditService auditService;
    private final MonitoringHealth monitoringHealth;

    public PositionLifecycleEngine(
            PositionOpeningExecutor positionOpeningExecutor,
            PositionStore positionStore,
            FillProcessor fillProcessor,
            FillReconciliationService fillReconciliationService,
            OrphanedOrderCleanupService orphanedOrderCleanupService,
            TimeExpiryEnforcer timeExpiryEnforcer,
            PositionLockRegistry positionLockRegistry,
            AuditService auditService,
            MonitoringHealth monitoringHealth) {
        this.positionOpeningExecutor = positionOpeningExecutor;
        this.positionStore = positionStore;
        this.fillProcessor = fillProcessor;
        this.fillReconciliationService = fillReconciliationService;
        this.orphanedOrderCleanupService = orphanedOrderCleanupService;
        this.timeExpiryEnforcer = timeExpiryEnforcer;
        this.positionLockRegistry = positionLockRegistry;
        this.auditService = auditService;
        this.monitoringHealth = monitoringHealth;
    }

    /**
     * Opens a position with its full protective set (or an emergency stop).
     */
    public Position openPosition(PositionRequest request) {
        return positionOpeningExecutor.open(request);
    }

    public EngineStatus getStatus() {
        MonitoringError lastError = monitoringHealth.getLastError();
        return EngineStatus.builder()
                .activeCount((int) positionStore.countActive())
                .monitoringEnabled(fillReconciliationService.isMonitoringEnabled())
                .cycleCount(monitoringHealth.getCycleCount())
                .lastCycleTime(monitoringHealth.getLastCycleTime())
                .lastSuccessfulCycleTime(monitoringHealth.getLastSuccessfulCycleTime())
                .lastError(lastError != null ? lastError.getMessage() : null)
                .lastErrorTime(lastError != null ? lastError.getTimestamp() : null)
                .recentErrors(monitoringHealth.getRecentErrors())
                .build();
    }

    /**
     * @return false when the position has no open time box
     */
    public boolean extendExpiry(String positionId, int hours) {
        positionStore.getOrThrow(positionId);
        return timeExpiryEnforcer.extendExpiry(positionId, hours, LocalDateTime.now());
    }

    /**
     * Cancels the protective orders of a position and marks it COMPLETED.
     *
     * @return false when the position was already closed or the close failed
     */
    public boolean forceClose(String positionId) {
        positionStore.getOrThrow(positionId);
        log.info("Manual force close requested for position {}", positionId);
        return timeExpiryEnforcer
                .forceClose(positionId, "manual", LocalDateTime.now())
                .orElseThrow(() -> BusinessException.positionBusy(positionId));
    }

    /**
     * Applies a fill that happened outside the managed orders (e.g. a partial close on the
     * exchange UI) and returns the updated position.
     */
    public Position recordManualFill(String positionId, int size, BigDecimal price) {
        if (size <= 0) {
            throw new BusinessException("Manual fill size must be positive", Map.of("size", size));
        }
        positionStore.getOrThrow(positionId);

        OrderFillEvent fill = OrderFillEvent.builder()
                .positionId(positionId)
                .orderId("MANUAL-" + UUID.randomUUID())
                .fillType(FillType.MANUAL)
                .fillSize(size)
                .fillPrice(price)
                .filledAt(LocalDateTime.now())
                .processed(false)
                .build();

        FillOutcome outcome = positionLockRegistry
                .withLock(positionId, () -> fillProcessor.process(fill))
                .orElseThrow(() -> BusinessException.positionBusy(positionId));
        log.info("Manual fill of {} on position {}: {}", size, positionId, outcome);
        return positionStore.getOrThrow(positionId);
    }

    public PositionDetails getPositionDetails(String positionId) {
        Position position = positionStore.getOrThrow(positionId);
        return PositionDetails.builder()
                .position(position)
                .timeTracking(positionStore.getTracking(positionId).orElse(null))
                .fills(positionStore.findFills(positionId))
                .auditTrail(auditService.getAuditTrail(positionId))
                .build();
    }

    public List<Position> listActivePositions() {
        return positionStore.listActive();
    }

    public List<TimeTrackingView> getTimeTrackingStatus() {
        return timeExpiryEnforcer.getTimeTrackingStatus(LocalDateTime.now());
    }

    public ReconciliationCycleResult runReconciliationNow() {
        log.info("Manual reconciliation triggered");
        return fillReconciliationService.runCycle("MANUAL");
    }

    public OrphanCleanupResult cleanupOrphanedOrders(String credentialId, String market) {
        return orphanedOrderCleanupService.cleanup(ExchangeScope.of(credentialId, market));
    }

    /**
     * Stops the reconciliation timer. Protective orders already on the exchange keep working.
     */
    public void emergencyStop() {
        fillReconciliationService.emergencyStop();
        monitoringHealth.recordError(ErrorSeverity.WARNING, "operator", "Monitoring stopped by operator");
    }

    public void resumeMonitoring() {
        fillReconciliationService.resume();
        monitoringHealth.recordError(ErrorSeverity.WARNING, "operator", "Monitoring resumed by operator");
    }
}
