package com.positionkeeper.oms;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.exception.ExchangeException;
import com.positionkeeper.exchange.ConditionalOrderSpec;
import com.positionkeeper.exchange.ExchangeClient;
import com.positionkeeper.exchange.PlacedOrder;
import com.positionkeeper.observability.MonitoringHealth;
import com.positionkeeper.service.AuditService;
import com.positionkeeper.store.PositionStore;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Mutates the protective orders of live positions.
 *
 * <p>Stop replacement is place-before-cancel:
 * <ol>
 *   <li>Place the new stop. If this fails nothing else happens and the old stop stays in force.</li>
 *   <li>Audit, then record the new stop id and price in the store.</li>
 *   <li>Cancel the old stop, best effort. A leftover reduce-only stop cannot add risk, so a
 *       failed cancel is logged and audited but not retried.</li>
 * </ol>
 * At no point does the position have zero working stops.
 */
@Service
public class ProtectiveOrderManager {

    private static final Logger log = LoggerFactory.getLogger(ProtectiveOrderManager.class);

    private final ExchangeClient exchangeClient;
    private final PositionStore positionStore;
    private final ProtectiveOrderFactory protectiveOrderFactory;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final MonitoringHealth monitoringHealth;

    public ProtectiveOrderManager(
            ExchangeClient exchangeClient,
            PositionStore positionStore,
            ProtectiveOrderFactory protectiveOrderFactory,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            MonitoringHealth monitoringHealth) {
        this.exchangeClient = exchangeClient;
        this.positionStore = positionStore;
        this.protectiveOrderFactory = protectiveOrderFactory;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.monitoringHealth = monitoringHealth;
    }

    /**
     * Replaces the stop of {@code position} with one at {@code newStopPrice}.
     *
     * @param reason SL_UPDATED_BREAK_EVEN or SL_UPDATED_TRAILING, recorded in the audit trail
     */
    public StopReplacementResult replaceStop(Position position, BigDecimal newStopPrice, AuditAction reason) {
        String oldOrderId = position.getStopOrderId();
        BigDecimal oldPrice = position.getCurrentStopPrice();

        if (oldPrice != null && oldPrice.compareTo(newStopPrice) == 0) {
            log.debug("Stop for position {} already at {}, nothing to replace", position.getId(), newStopPrice);
            return StopReplacementResult.unchanged(oldOrderId, newStopPrice);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("oldOrderId", oldOrderId);
        details.put("oldPrice", oldPrice);
        details.put("newPrice", newStopPrice);

        // Step 1: place the new stop while the old one is still working
        ConditionalOrderSpec spec = protectiveOrderFactory.stop(
                position.getSymbol(), position.getDirection(), newStopPrice, ProtectiveOrderFactory.LABEL_STOP);
        String newOrderId;
        try {
            newOrderId = exchangeClient.placeConditionalOrder(position.scope(), spec);
        } catch (ExchangeException e) {
            auditService.failure(position.getId(), reason, details, e.getMessage());
            monitoringHealth.recordError(
                    ErrorSeverity.ERROR, position.getId(), "Stop replacement placement failed: " + e.getMessage());
            log.error(
                    "Failed to place replacement stop for position {} at {}; keeping stop {} at {}",
                    position.getId(),
                    newStopPrice,
                    oldOrderId,
                    oldPrice,
                    e);
            return StopReplacementResult.failed(oldOrderId, newStopPrice, e.getMessage());
        }
        details.put("newOrderId", newOrderId);

        // Step 2: audit, then record the confirmed order
        auditService.success(position.getId(), reason, details);
        boolean stored = positionStore.replaceStopOrder(position.getId(), newOrderId, newStopPrice);
        if (!stored) {
            // Position closed in the meantime: the new stop protects nothing
            log.warn("Position {} closed while replacing stop, cancelling new stop {}", position.getId(), newOrderId);
            cancelQuietly(position, newOrderId);
            return StopReplacementResult.failed(oldOrderId, newStopPrice, "Position closed during replacement");
        }

        // Step 3: best-effort removal of the old stop
        boolean oldCancelled = oldOrderId == null || cancelQuietly(position, oldOrderId);
        if (!oldCancelled) {
            auditService.failure(
                    position.getId(),
                    AuditAction.STALE_STOP_CANCEL_FAILED,
                    Map.of("orderId", oldOrderId),
                    "Stale reduce-only stop left on exchange");
        }

        log.info(
                "Stop replaced for position {} ({}): {} @ {} -> {} @ {}",
                position.getId(),
                reason,
                oldOrderId,
                oldPrice,
                newOrderId,
                newStopPrice);

        Position updated = position.toBuilder()
                .stopOrderId(newOrderId)
                .currentStopPrice(newStopPrice)
                .build();
        eventPublisherHelper.publishStopReplaced(this, updated, details);

        return StopReplacementResult.builder()
                .replaced(true)
                .oldOrderId(oldOrderId)
                .newOrderId(newOrderId)
                .newPrice(newStopPrice)
                .oldStopCancelled(oldCancelled)
                .build();
    }

    /**
     * Cancels every protective order of {@code position} that may still be working, best effort.
     *
     * <p>Take-profit orders whose tier already filled (by phase) are skipped. Pass the position
     * as it was before any terminal transition so the order ids are still meaningful.
     */
    public CancellationResult cancelProtectiveOrders(Position position) {
        Set<String> orderIds = new LinkedHashSet<>();
        if (position.getPhase() == PositionPhase.INITIAL && position.getTp1OrderId() != null) {
            orderIds.add(position.getTp1OrderId());
        }
        if ((position.getPhase() == PositionPhase.INITIAL || position.getPhase() == PositionPhase.TP1_FILLED)
                && position.getTp2OrderId() != null) {
            orderIds.add(position.getTp2OrderId());
        }
        if (position.getStopOrderId() != null) {
            orderIds.add(position.getStopOrderId());
        }

        List<String> cancelled = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String orderId : orderIds) {
            try {
                exchangeClient.cancelConditionalOrder(position.scope(), orderId);
                cancelled.add(orderId);
                log.info("Cancelled protective order {} of position {}", orderId, position.getId());
            } catch (ExchangeException e) {
                failed.put(orderId, e.getMessage());
                log.warn("Failed to cancel order {} of position {}: {}", orderId, position.getId(), e.getMessage());
            }
        }
        return CancellationResult.builder()
                .cancelledOrderIds(cancelled)
                .failedOrderIds(failed)
                .build();
    }

    /**
     * Sends a reduce-only market order for the remaining size of {@code position}.
     *
     * @throws ExchangeException if the order is rejected
     */
    public PlacedOrder flatten(Position position) {
        PlacedOrder placed = exchangeClient.placeMarketOrder(
                position.scope(),
                protectiveOrderFactory.flatten(
                        position.getSymbol(), position.getDirection(), position.getRemainingSize()));
        log.info(
                "Flattened position {}: {} contracts, order {}",
                position.getId(),
                position.getRemainingSize(),
                placed.getOrderId());
        return placed;
    }

    private boolean cancelQuietly(Position position, String orderId) {
        try {
            exchangeClient.cancelConditionalOrder(position.scope(), orderId);
            return true;
        } catch (ExchangeException e) {
            log.warn("Failed to cancel order {} of position {}: {}", orderId, position.getId(), e.getMessage());
            return false;
        }
    }

    /** Result of a stop replacement. */
    @Data
    @Builder
    public static class StopReplacementResult {
        private boolean replaced;
        private String oldOrderId;
        private String newOrderId;
        private BigDecimal newPrice;
        private boolean oldStopCancelled;
        private String failureReason;

        public static StopReplacementResult unchanged(String orderId, BigDecimal price) {
            return StopReplacementResult.builder()
                    .replaced(false)
                    .oldOrderId(orderId)
                    .newOrderId(orderId)
                    .newPrice(price)
                    .build();
        }

        public static StopReplacementResult failed(String oldOrderId, BigDecimal price, String reason) {
            return StopReplacementResult.builder()
                    .replaced(false)
                    .oldOrderId(oldOrderId)
                    .newPrice(price)
                    .failureReason(reason)
                    .build();
        }
    }

    /** Outcome of a best-effort cancellation sweep over one position's orders. */
    @Data
    @Builder
    public static class CancellationResult {
        private List<String> cancelledOrderIds;
        private Map<String, String> failedOrderIds;

        public boolean isComplete() {
            return failedOrderIds.isEmpty();
        }
    }
}
