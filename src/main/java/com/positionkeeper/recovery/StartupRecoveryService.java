package com.positionkeeper.recovery;

import com.positionkeeper.core.PositionLockRegistry;
import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.model.OrderFillEvent;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ReconciliationCycleResult;
import com.positionkeeper.oms.FillOutcome;
import com.positionkeeper.oms.FillProcessor;
import com.positionkeeper.reconciliation.FillReconciliationService;
import com.positionkeeper.store.PositionStore;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Runs the startup recovery sequence once the application is ready.
 *
 * <ol>
 *   <li>Re-apply fill events that were recorded but not marked processed (crash between
 *       recording a fill and applying it)</li>
 *   <li>Count active positions and flag those protected by an emergency stop only</li>
 *   <li>Run one reconciliation cycle: positions closed while the process was down are
 *       completed, and order snapshots are seeded for the next cycle</li>
 * </ol>
 *
 * <p>Fills that happened while the process was down and did not close the position cannot be
 * attributed: the order snapshot is in memory only.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final PositionStore positionStore;
    private final FillProcessor fillProcessor;
    private final FillReconciliationService fillReconciliationService;
    private final PositionLockRegistry positionLockRegistry;

    public StartupRecoveryService(
            PositionStore positionStore,
            FillProcessor fillProcessor,
            FillReconciliationService fillReconciliationService,
            PositionLockRegistry positionLockRegistry) {
        this.positionStore = positionStore;
        this.fillProcessor = fillProcessor;
        this.fillReconciliationService = fillReconciliationService;
        this.positionLockRegistry = positionLockRegistry;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Starting position recovery sequence...");

        RecoveryResult recoveryResult =
                RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            resumeUnprocessedFills(recoveryResult);
            inspectActivePositions(recoveryResult);
            reconcilePositions(recoveryResult);

            recoveryResult.setSuccess(true);
        } catch (RuntimeException e) {
            recoveryResult.setSuccess(false);
            recoveryResult.setError(e.getMessage());
            log.error("Recovery sequence failed", e);
        }

        recoveryResult.setDurationMs(System.currentTimeMillis() - recoveryResult.getStartedAt());
        log.info(
                "Startup recovery {}: duration={}ms, fillsResumed={}/{}, activePositions={}, emergencyOnly={}, closedWhileDown={}",
                recoveryResult.isSuccess() ? "completed" : "failed",
                recoveryResult.getDurationMs(),
                recoveryResult.getFillsResumed(),
                recoveryResult.getUnprocessedFillsFound(),
                recoveryResult.getActivePositions(),
                recoveryResult.getEmergencyProtectedPositions(),
                recoveryResult.getPositionsClosedWhileDown());
        return recoveryResult;
    }

    void resumeUnprocessedFills(RecoveryResult recoveryResult) {
        List<OrderFillEvent> unprocessed = positionStore.findUnprocessedFills();
        recoveryResult.setUnprocessedFillsFound(unprocessed.size());
        if (unprocessed.isEmpty()) {
            log.info("No unprocessed fill events found");
            return;
        }

        log.warn("Found {} unprocessed fill events, re-applying", unprocessed.size());
        for (OrderFillEvent fill : unprocessed) {
            try {
                Optional<FillOutcome> outcome =
                        positionLockRegistry.withLock(fill.getPositionId(), () -> fillProcessor.resume(fill));
                if (outcome.isPresent()) {
                    recoveryResult.setFillsResumed(recoveryResult.getFillsResumed() + 1);
                } else {
                    recoveryResult.getFailedFillOrderIds().add(fill.getOrderId());
                }
            } catch (RuntimeException e) {
                recoveryResult.getFailedFillOrderIds().add(fill.getOrderId());
                log.error("Could not re-apply fill for order {} (position {})", fill.getOrderId(), fill.getPositionId(), e);
            }
        }
    }

    void inspectActivePositions(RecoveryResult recoveryResult) {
        List<Position> active = positionStore.listActive();
        recoveryResult.setActivePositions(active.size());
        for (Position position : active) {
            if (position.getPhase() == PositionPhase.INITIAL && position.getTp1OrderId() == null) {
                recoveryResult.setEmergencyProtectedPositions(recoveryResult.getEmergencyProtectedPositions() + 1);
                log.warn(
                        "Position {} ({}) is protected by an emergency stop only, take-profits were never placed",
                        position.getId(),
                        position.getSymbol());
            }
        }
        log.info("{} active positions restored from the store", active.size());
    }

    void reconcilePositions(RecoveryResult recoveryResult) {
        if (!fillReconciliationService.isMonitoringEnabled()) {
            log.info("Reconciliation disabled, skipping startup cycle");
            return;
        }
        ReconciliationCycleResult cycle = fillReconciliationService.runCycle("STARTUP");
        recoveryResult.setPositionsClosedWhileDown(cycle.getPositionsClosedRemotely());
        recoveryResult.setReconciliationFailed(cycle.hasErrors());
        if (cycle.hasErrors()) {
            log.warn("Startup reconciliation had group errors: {}", cycle.getGroupErrors());
        }
    }
}
