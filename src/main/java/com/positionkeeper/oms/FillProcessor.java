package com.positionkeeper.oms;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.enums.FillType;
import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.model.OrderFillEvent;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.observability.MonitoringHealth;
import com.positionkeeper.service.AuditService;
import com.positionkeeper.store.PositionStore;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies fills to positions according to the phase rules.
 *
 * <ul>
 *   <li><b>TP1</b> (from INITIAL): remaining -= tp1 size, PnL accrued, phase TP1_FILLED, stop to break-even</li>
 *   <li><b>TP2</b> (from TP1_FILLED): remaining -= tp2 size, PnL accrued, phase TP2_FILLED, stop trails</li>
 *   <li><b>SL</b>: remaining 0, phase STOPPED_OUT, leftover take-profits cancelled</li>
 *   <li><b>MANUAL</b>: remaining reduced (floor 0), phase kept, COMPLETED when nothing is left</li>
 * </ul>
 *
 * <p>Idempotency has two layers. A fill is inserted at most once per order id, so the same
 * disappearance seen twice is dropped. A fill whose tier does not match the current phase
 * is marked processed without effect. If the phase already equals the tier's target phase
 * (a fill resumed after a crash), only the stop migration is completed.
 *
 * <p>Callers must hold the position in {@code PositionLockRegistry}.
 */
@Service
public class FillProcessor {

    private static final Logger log = LoggerFactory.getLogger(FillProcessor.class);

    private final PositionStore positionStore;
    private final ProtectiveOrderManager protectiveOrderManager;
    private final StopPriceCalculator stopPriceCalculator;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final MonitoringHealth monitoringHealth;

    public FillProcessor(
            PositionStore positionStore,
            ProtectiveOrderManager protectiveOrderManager,
            StopPriceCalculator stopPriceCalculator,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            MonitoringHealth monitoringHealth) {
        this.positionStore = positionStore;
        this.protectiveOrderManager = protectiveOrderManager;
        this.stopPriceCalculator = stopPriceCalculator;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.monitoringHealth = monitoringHealth;
    }

    /**
     * Records a new fill and applies it. A fill whose order id was already recorded and
     * processed is dropped; one recorded but never processed is resumed.
     */
    public FillOutcome process(OrderFillEvent fill) {
        if (!positionStore.recordFill(fill)) {
            Optional<OrderFillEvent> recorded = positionStore.findFill(fill.getOrderId());
            if (recorded.isPresent() && !recorded.get().isProcessed()) {
                return resume(recorded.get());
            }
            log.info("Fill for order {} already recorded, ignoring duplicate", fill.getOrderId());
            return FillOutcome.DUPLICATE;
        }
        return apply(fill);
    }

    /**
     * Applies a fill that was recorded earlier but never marked processed.
     */
    public FillOutcome resume(OrderFillEvent fill) {
        if (fill.isProcessed()) {
            return FillOutcome.DUPLICATE;
        }
        log.info("Resuming unprocessed {} fill for order {} (position {})", fill.getFillType(), fill.getOrderId(), fill.getPositionId());
        return apply(fill);
    }

    private FillOutcome apply(OrderFillEvent fill) {
        Position position = positionStore.getOrThrow(fill.getPositionId());

        if (position.getPhase().isTerminal()) {
            return ignore(fill, position, "position already " + position.getPhase());
        }

        FillOutcome outcome = switch (fill.getFillType()) {
            case TP1 -> applyTier(fill, position, PositionPhase.INITIAL, PositionPhase.TP1_FILLED);
            case TP2 -> applyTier(fill, position, PositionPhase.TP1_FILLED, PositionPhase.TP2_FILLED);
            case SL -> applyStop(fill, position);
            case MANUAL -> applyManual(fill, position);
        };

        if (outcome != FillOutcome.IGNORED) {
            positionStore.markFillProcessed(fill.getOrderId());
        }
        return outcome;
    }

    private FillOutcome applyTier(
            OrderFillEvent fill, Position position, PositionPhase requiredPhase, PositionPhase targetPhase) {
        if (position.getPhase() == targetPhase) {
            // Transition already written before a crash, finish the stop migration
            migrateStop(fill, position);
            return FillOutcome.APPLIED;
        }
        if (position.getPhase() != requiredPhase) {
            return ignore(fill, position, fill.getFillType() + " fill not applicable in phase " + position.getPhase());
        }

        int remainingAfter = position.getRemainingSize() - fill.getFillSize();
        BigDecimal pnl = realizedPnl(position, fill.getFillPrice(), fill.getFillSize());
        AuditAction action = fill.getFillType() == FillType.TP1 ? AuditAction.TP1_FILLED : AuditAction.TP2_FILLED;
        auditService.success(position.getId(), action, fillDetails(fill, position, remainingAfter, pnl));

        if (remainingAfter <= 0) {
            // No runner left: the tier closed the whole position
            Position closed = positionStore.applyPhaseTransition(
                    position.getId(), PositionPhase.COMPLETED, 0, pnl, "all tiers filled");
            protectiveOrderManager.cancelProtectiveOrders(position.toBuilder()
                    .phase(targetPhase)
                    .build());
            auditService.success(position.getId(), AuditAction.POSITION_COMPLETED, Map.of("reason", "all tiers filled"));
            eventPublisherHelper.publishFillApplied(this, closed, eventDetails(fill));
            return FillOutcome.APPLIED;
        }

        Position updated = positionStore.applyPhaseTransition(position.getId(), targetPhase, remainingAfter, pnl, null);
        log.info(
                "{} fill applied to position {}: size={}, price={}, remaining={}, pnl={}",
                fill.getFillType(),
                position.getId(),
                fill.getFillSize(),
                fill.getFillPrice(),
                remainingAfter,
                pnl);
        eventPublisherHelper.publishFillApplied(this, updated, eventDetails(fill));

        migrateStop(fill, updated);
        return FillOutcome.APPLIED;
    }

    private FillOutcome applyStop(OrderFillEvent fill, Position position) {
        BigDecimal pnl = realizedPnl(position, fill.getFillPrice(), position.getRemainingSize());
        auditService.success(position.getId(), AuditAction.SL_FILLED, fillDetails(fill, position, 0, pnl));

        Position stopped = positionStore.applyPhaseTransition(
                position.getId(), PositionPhase.STOPPED_OUT, 0, pnl, "stop filled");

        // The filled stop is gone; a replacement placed after it triggered may still be working
        String workingStop = fill.getOrderId().equals(position.getStopOrderId()) ? null : position.getStopOrderId();
        protectiveOrderManager.cancelProtectiveOrders(
                position.toBuilder().stopOrderId(workingStop).build());

        auditService.success(position.getId(), AuditAction.POSITION_STOPPED_OUT, Map.of("orderId", fill.getOrderId()));
        log.info("Position {} stopped out at {}, pnl={}", position.getId(), fill.getFillPrice(), pnl);
        eventPublisherHelper.publishFillApplied(this, stopped, eventDetails(fill));
        return FillOutcome.APPLIED;
    }

    private FillOutcome applyManual(OrderFillEvent fill, Position position) {
        int reduceBy = Math.min(fill.getFillSize(), position.getRemainingSize());
        int remainingAfter = position.getRemainingSize() - reduceBy;
        BigDecimal pnl = fill.getFillPrice() != null ? realizedPnl(position, fill.getFillPrice(), reduceBy) : null;
        auditService.success(position.getId(), AuditAction.MANUAL_FILLED, fillDetails(fill, position, remainingAfter, pnl));

        Position updated;
        if (remainingAfter == 0) {
            updated = positionStore.applyPhaseTransition(
                    position.getId(), PositionPhase.COMPLETED, 0, pnl, "manually closed");
            protectiveOrderManager.cancelProtectiveOrders(position);
            auditService.success(position.getId(), AuditAction.POSITION_COMPLETED, Map.of("reason", "manually closed"));
        } else {
            updated = positionStore.applyPhaseTransition(position.getId(), position.getPhase(), remainingAfter, pnl, null);
        }
        log.info("Manual fill applied to position {}: reduced by {}, remaining={}", position.getId(), reduceBy, remainingAfter);
        eventPublisherHelper.publishFillApplied(this, updated, eventDetails(fill));
        return FillOutcome.APPLIED;
    }

    private void migrateStop(OrderFillEvent fill, Position position) {
        BigDecimal newStop;
        AuditAction reason;
        if (fill.getFillType() == FillType.TP1) {
            newStop = stopPriceCalculator.breakEven(position.getEntryPrice(), position.getDirection());
            reason = AuditAction.SL_UPDATED_BREAK_EVEN;
        } else {
            newStop = stopPriceCalculator.trailing(
                    fill.getFillPrice(), position.getDirection(), position.getCurrentStopPrice());
            reason = AuditAction.SL_UPDATED_TRAILING;
        }

        ProtectiveOrderManager.StopReplacementResult result =
                protectiveOrderManager.replaceStop(position, newStop, reason);
        if (!result.isReplaced() && result.getFailureReason() != null) {
            // Old stop is still working; the next tier or expiry will act on the position
            monitoringHealth.recordError(
                    ErrorSeverity.WARNING,
                    position.getId(),
                    "Stop not moved after " + fill.getFillType() + ": " + result.getFailureReason());
        }
    }

    private FillOutcome ignore(OrderFillEvent fill, Position position, String reason) {
        log.info("Ignoring {} fill for order {} on position {}: {}", fill.getFillType(), fill.getOrderId(), position.getId(), reason);
        auditService.success(
                position.getId(),
                AuditAction.FILL_IGNORED,
                Map.of("orderId", fill.getOrderId(), "fillType", fill.getFillType().name(), "reason", reason));
        positionStore.markFillProcessed(fill.getOrderId());
        return FillOutcome.IGNORED;
    }

    /** (fill - entry) * direction sign * size. */
    public static BigDecimal realizedPnl(Position position, BigDecimal fillPrice, int size) {
        return fillPrice
                .subtract(position.getEntryPrice())
                .multiply(position.getDirection().sign())
                .multiply(BigDecimal.valueOf(size));
    }

    private Map<String, Object> fillDetails(OrderFillEvent fill, Position position, int remainingAfter, BigDecimal pnl) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderId", fill.getOrderId());
        details.put("fillType", fill.getFillType().name());
        details.put("fillSize", fill.getFillSize());
        details.put("fillPrice", fill.getFillPrice());
        details.put("remainingBefore", position.getRemainingSize());
        details.put("remainingAfter", remainingAfter);
        details.put("realizedPnl", pnl);
        return details;
    }

    private Map<String, Object> eventDetails(OrderFillEvent fill) {
        return Map.of("fillType", fill.getFillType().name(), "orderId", fill.getOrderId());
    }
}
