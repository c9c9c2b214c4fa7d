package com.positionkeeper.reconciliation;

import com.positionkeeper.core.PositionLockRegistry;
import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.enums.FillType;
import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.domain.model.OrderFillEvent;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ReconciliationCycleResult;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.exchange.ExchangeClient;
import com.positionkeeper.exchange.RemoteConditionalOrder;
import com.positionkeeper.exchange.RemotePosition;
import com.positionkeeper.observability.MonitoringHealth;
import com.positionkeeper.oms.FillOutcome;
import com.positionkeeper.oms.FillProcessor;
import com.positionkeeper.oms.ProtectiveOrderManager;
import com.positionkeeper.service.AuditService;
import com.positionkeeper.store.PositionStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps local position state in line with the exchange, which never pushes fills.
 *
 * <p>Each cycle, per credential+market group:
 * <ol>
 *   <li><b>Position reconciliation</b>: one {@code listPositions} call. A tracked position that is
 *       absent or flat remotely is COMPLETED ("closed remotely") and its leftover protective
 *       orders are cancelled. No fill is synthesized because the cause cannot be known.</li>
 *   <li><b>Order diffing</b>: one {@code listConditionalOrders} call. For each surviving position
 *       the open order ids are compared with the ids seen in the previous cycle. An id that
 *       disappeared and matches the stored tp1, tp2 or stop id is an inferred fill.</li>
 * </ol>
 *
 * <p>The previous-cycle snapshot lives in memory only. A position without a snapshot (first
 * observation, or after a restart) is only seeded: no history means no inferred fills.
 *
 * <p>Fill size is approximated from the tier size (stop: remaining size) and fill price from the
 * last seen trigger price, as the order list reports neither.
 *
 * <p>A cycle never overlaps the previous one, and a failure in one group is recorded without
 * aborting the others.
 */
@Service
public class FillReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(FillReconciliationService.class);

    private final ExchangeClient exchangeClient;
    private final PositionStore positionStore;
    private final FillProcessor fillProcessor;
    private final ProtectiveOrderManager protectiveOrderManager;
    private final PositionLockRegistry positionLockRegistry;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final MonitoringHealth monitoringHealth;

    /** positionId -> (orderId -> trigger price) as seen in the last completed diff. */
    private final Map<String, Map<String, BigDecimal>> orderSnapshots = new ConcurrentHashMap<>();

    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private final AtomicBoolean monitoringEnabled;

    public FillReconciliationService(
            ExchangeClient exchangeClient,
            PositionStore positionStore,
            FillProcessor fillProcessor,
            ProtectiveOrderManager protectiveOrderManager,
            PositionLockRegistry positionLockRegistry,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            MonitoringHealth monitoringHealth,
            @Value("${positionkeeper.reconciliation.enabled:true}") boolean enabled) {
        this.exchangeClient = exchangeClient;
        this.positionStore = positionStore;
        this.fillProcessor = fillProcessor;
        this.protectiveOrderManager = protectiveOrderManager;
        this.positionLockRegistry = positionLockRegistry;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.monitoringHealth = monitoringHealth;
        this.monitoringEnabled = new AtomicBoolean(enabled);
    }

    @Scheduled(
            fixedDelayString = "${positionkeeper.reconciliation.interval-ms:30000}",
            initialDelayString = "${positionkeeper.reconciliation.interval-ms:30000}")
    public void scheduledCycle() {
        if (!monitoringEnabled.get()) {
            return;
        }
        runCycle("SCHEDULED");
    }

    /**
     * Runs one reconciliation cycle. Returns a skipped result when a cycle is already running.
     */
    public ReconciliationCycleResult runCycle(String trigger) {
        LocalDateTime startedAt = LocalDateTime.now();
        if (!cycleRunning.compareAndSet(false, true)) {
            log.debug("Reconciliation cycle already in progress, skipping {} trigger", trigger);
            return ReconciliationCycleResult.builder()
                    .trigger(trigger)
                    .startedAt(startedAt)
                    .completedAt(startedAt)
                    .skipped(true)
                    .build();
        }

        ReconciliationCycleResult result = ReconciliationCycleResult.builder()
                .trigger(trigger)
                .startedAt(startedAt)
                .build();
        try {
            List<Position> activePositions = positionStore.listActive();
            result.setPositionsChecked(activePositions.size());
            dropStaleSnapshots(activePositions);

            Map<ExchangeScope, List<Position>> groups = activePositions.stream()
                    .collect(Collectors.groupingBy(Position::scope, LinkedHashMap::new, Collectors.toList()));

            for (Map.Entry<ExchangeScope, List<Position>> group : groups.entrySet()) {
                try {
                    reconcileGroup(group.getKey(), group.getValue(), result);
                } catch (RuntimeException e) {
                    String message = group.getKey() + ": " + e.getMessage();
                    result.getGroupErrors().add(message);
                    monitoringHealth.recordError(ErrorSeverity.ERROR, "reconciliation", message);
                    log.warn("Reconciliation of group {} failed, retrying next cycle: {}", group.getKey(), e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            result.getGroupErrors().add("cycle: " + e.getMessage());
            monitoringHealth.recordError(ErrorSeverity.ERROR, "reconciliation", e.getMessage());
            log.error("Reconciliation cycle failed", e);
        } finally {
            result.setCompletedAt(LocalDateTime.now());
            cycleRunning.set(false);
        }

        monitoringHealth.recordCycle(result.getCompletedAt(), !result.hasErrors());
        eventPublisherHelper.publishReconciliationCycle(this, result);

        if (result.getPositionsClosedRemotely() > 0 || result.getFillsInferred() > 0 || result.hasErrors()) {
            log.info(
                    "Reconciliation {} complete: checked={}, closedRemotely={}, fillsInferred={}, groupErrors={}",
                    trigger,
                    result.getPositionsChecked(),
                    result.getPositionsClosedRemotely(),
                    result.getFillsInferred(),
                    result.getGroupErrors().size());
        } else {
            log.debug("Reconciliation {} complete: checked={}, no changes", trigger, result.getPositionsChecked());
        }
        return result;
    }

    private void reconcileGroup(ExchangeScope scope, List<Position> positions, ReconciliationCycleResult result) {
        // Step 1: gross reconciliation against remote positions
        Map<String, Integer> remoteSizes = exchangeClient.listPositions(scope).stream()
                .collect(Collectors.toMap(RemotePosition::getSymbol, RemotePosition::getSize, Integer::sum));

        List<Position> survivors = new ArrayList<>();
        for (Position position : positions) {
            int remoteSize = remoteSizes.getOrDefault(position.getSymbol(), 0);
            if (remoteSize == 0) {
                positionLockRegistry
                        .withLock(position.getId(), () -> completeClosedRemotely(position.getId()))
                        .filter(Boolean::booleanValue)
                        .ifPresent(closed -> result.setPositionsClosedRemotely(result.getPositionsClosedRemotely() + 1));
            } else {
                survivors.add(position);
            }
        }
        if (survivors.isEmpty()) {
            return;
        }

        // Step 2: order diffing for the positions still open
        List<RemoteConditionalOrder> openOrders = exchangeClient.listConditionalOrders(scope);
        for (Position position : survivors) {
            // Trigger prices may be null for some order types
            Map<String, BigDecimal> current = new LinkedHashMap<>();
            for (RemoteConditionalOrder order : openOrders) {
                if (position.getSymbol().equals(order.getSymbol())) {
                    current.putIfAbsent(order.getId(), order.getTriggerPrice());
                }
            }

            Optional<Integer> inferred =
                    positionLockRegistry.withLock(position.getId(), () -> diffOrders(position.getId(), current));
            // A locked position keeps its old snapshot so the disappearance is seen next cycle
            inferred.ifPresent(count -> result.setFillsInferred(result.getFillsInferred() + count));
        }
    }

    /**
     * Completes a position that no longer exists remotely. Returns false if it was already terminal.
     */
    boolean completeClosedRemotely(String positionId) {
        Position position = positionStore.getOrThrow(positionId);
        if (position.getPhase().isTerminal()) {
            return false;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", position.getSymbol());
        details.put("phase", position.getPhase().name());
        details.put("remainingSize", position.getRemainingSize());
        auditService.success(positionId, AuditAction.POSITION_AUTO_COMPLETED, details);

        Position closed = positionStore.applyPhaseTransition(positionId, PositionPhase.COMPLETED, 0, null, "closed remotely");
        log.info("Position {} ({}) no longer open remotely, marked COMPLETED", positionId, position.getSymbol());

        ProtectiveOrderManager.CancellationResult cancellation = protectiveOrderManager.cancelProtectiveOrders(position);
        if (!cancellation.isComplete()) {
            log.warn("Leftover orders of remotely closed position {} not cancelled: {}", positionId, cancellation.getFailedOrderIds());
        }
        orderSnapshots.remove(positionId);
        eventPublisherHelper.publishClosedRemotely(this, closed);
        return true;
    }

    /**
     * Compares {@code current} with the stored snapshot of {@code positionId}, feeds inferred
     * fills to the {@link FillProcessor} and then stores {@code current} as the new snapshot.
     *
     * @return number of fills applied
     */
    int diffOrders(String positionId, Map<String, BigDecimal> current) {
        Map<String, BigDecimal> previous = orderSnapshots.get(positionId);
        if (previous == null) {
            orderSnapshots.put(positionId, new LinkedHashMap<>(current));
            log.debug("Seeded order snapshot for position {} with {} orders", positionId, current.size());
            return 0;
        }

        Position position = positionStore.getOrThrow(positionId);
        List<OrderFillEvent> fills = new ArrayList<>();
        for (Map.Entry<String, BigDecimal> seen : previous.entrySet()) {
            String orderId = seen.getKey();
            if (current.containsKey(orderId)) {
                continue;
            }
            FillType fillType = classify(position, orderId);
            if (fillType == null) {
                // Our own cancellations (replaced stops, rollback) also disappear
                log.debug("Order {} of position {} disappeared but is not a live protective order", orderId, positionId);
                continue;
            }
            fills.add(OrderFillEvent.builder()
                    .positionId(positionId)
                    .orderId(orderId)
                    .fillType(fillType)
                    .fillSize(fillSize(position, fillType))
                    .fillPrice(seen.getValue() != null ? seen.getValue() : plannedPrice(position, fillType))
                    .filledAt(LocalDateTime.now())
                    .processed(false)
                    .build());
        }

        fills.sort(Comparator.comparing(OrderFillEvent::getFillType));
        int applied = 0;
        for (OrderFillEvent fill : fills) {
            log.info("Inferred {} fill for position {} from disappearance of order {}", fill.getFillType(), positionId, fill.getOrderId());
            if (fillProcessor.process(fill) == FillOutcome.APPLIED) {
                applied++;
            }
        }
        // Only advance the snapshot once every fill went through; a failure retries next cycle
        if (positionStore.getOrThrow(positionId).getPhase().isTerminal()) {
            orderSnapshots.remove(positionId);
        } else {
            orderSnapshots.put(positionId, new LinkedHashMap<>(current));
        }
        return applied;
    }

    private static BigDecimal plannedPrice(Position position, FillType fillType) {
        return switch (fillType) {
            case TP1 -> position.getTp1Price();
            case TP2 -> position.getTp2Price();
            default -> position.getCurrentStopPrice();
        };
    }

    private FillType classify(Position position, String orderId) {
        if (orderId.equals(position.getTp1OrderId())) {
            return FillType.TP1;
        }
        if (orderId.equals(position.getTp2OrderId())) {
            return FillType.TP2;
        }
        if (orderId.equals(position.getStopOrderId())) {
            return FillType.SL;
        }
        return null;
    }

    private int fillSize(Position position, FillType fillType) {
        return switch (fillType) {
            case TP1 -> position.getTp1Size();
            case TP2 -> position.getTp2Size();
            default -> position.getRemainingSize();
        };
    }

    private void dropStaleSnapshots(List<Position> activePositions) {
        orderSnapshots.keySet().retainAll(
                activePositions.stream().map(Position::getId).collect(Collectors.toSet()));
    }

    // ---- Monitoring control ----

    public void emergencyStop() {
        monitoringEnabled.set(false);
        log.warn("Reconciliation monitoring stopped by operator");
    }

    public void resume() {
        monitoringEnabled.set(true);
        log.info("Reconciliation monitoring resumed");
    }

    public boolean isMonitoringEnabled() {
        return monitoringEnabled.get();
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }

    boolean hasSnapshot(String positionId) {
        return orderSnapshots.containsKey(positionId);
    }
}
