package com.positionkeeper.oms;

import com.positionkeeper.core.PositionLockRegistry;
import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.enums.TrackingStatus;
import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.domain.model.LifecycleSettings;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.PositionRequest;
import com.positionkeeper.domain.model.TimeTracking;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.exception.BusinessException;
import com.positionkeeper.exception.ErrorCode;
import com.positionkeeper.exception.ExchangeException;
import com.positionkeeper.exception.UnprotectedPositionException;
import com.positionkeeper.exchange.ConditionalOrderSpec;
import com.positionkeeper.exchange.ExchangeClient;
import com.positionkeeper.exchange.PlacedOrder;
import com.positionkeeper.observability.MonitoringHealth;
import com.positionkeeper.service.AuditService;
import com.positionkeeper.store.PositionStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Opens a position and puts its protective orders in place, never leaving a filled entry
 * silently unprotected.
 *
 * <p>Protocol:
 * <ol>
 *   <li>Validate the request and reject a second open position on the same symbol + scope. The
 *       symbol + scope key is held in the {@link PositionLockRegistry} until the position is
 *       stored, so a concurrent open for the same key is rejected too.</li>
 *   <li>Place the market entry. If it fails nothing is open and the error propagates.</li>
 *   <li>Place tp1, tp2 and the stop concurrently.</li>
 *   <li>All three placed: persist the position in phase INITIAL.</li>
 *   <li>A take-profit failed but the stop was placed: cancel the placed take-profits and keep
 *       that stop as the sole protection.</li>
 *   <li>The stop failed: place a single emergency stop first, then cancel the placed
 *       take-profits, and persist the position protected by the emergency stop alone.</li>
 *   <li>Emergency stop also fails: audit, flag CRITICAL and throw
 *       {@link UnprotectedPositionException}.</li>
 * </ol>
 *
 * <p>Outcome is always {entry, tp1, tp2, stop}, {entry, stop}, or a CRITICAL failure. A placed
 * stop is never cancelled before another stop is working.
 */
@Component
public class PositionOpeningExecutor {

    private static final Logger log = LoggerFactory.getLogger(PositionOpeningExecutor.class);

    private final ExchangeClient exchangeClient;
    private final PositionStore positionStore;
    private final ProtectiveOrderFactory protectiveOrderFactory;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final MonitoringHealth monitoringHealth;
    private final LifecycleSettings lifecycleSettings;
    private final Executor protectionExecutor;
    private final PositionLockRegistry lockRegistry;

    public PositionOpeningExecutor(
            ExchangeClient exchangeClient,
            PositionStore positionStore,
            ProtectiveOrderFactory protectiveOrderFactory,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            MonitoringHealth monitoringHealth,
            LifecycleSettings lifecycleSettings,
            @Qualifier("protectionExecutor") Executor protectionExecutor,
            PositionLockRegistry lockRegistry) {
        this.exchangeClient = exchangeClient;
        this.positionStore = positionStore;
        this.protectiveOrderFactory = protectiveOrderFactory;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.monitoringHealth = monitoringHealth;
        this.lifecycleSettings = lifecycleSettings;
        this.protectionExecutor = protectionExecutor;
        this.lockRegistry = lockRegistry;
    }

    /**
     * Runs the creation batch for {@code request}.
     *
     * @return the stored position; {@code tp1OrderId == null} means only the emergency stop protects it
     * @throws BusinessException            if the request is invalid or a position is already open
     * @throws ExchangeException            if the entry order fails (nothing was opened)
     * @throws UnprotectedPositionException if the entry filled but no stop could be placed
     */
    public Position open(PositionRequest request) {
        // Step 1: validation and duplicate guard
        validate(request);
        ExchangeScope scope = request.scope();
        String openKey = openKey(request.getSymbol(), scope);
        if (!lockRegistry.tryLock(openKey)) {
            throw duplicate(request.getSymbol(), scope, "Position is being opened for %s on %s");
        }
        try {
            if (positionStore.hasActivePosition(request.getSymbol(), scope)) {
                throw duplicate(request.getSymbol(), scope, "Position already open for %s on %s");
            }
            return openGuarded(request, scope);
        } finally {
            lockRegistry.unlock(openKey);
        }
    }

    private Position openGuarded(PositionRequest request, ExchangeScope scope) {
        String positionId = UUID.randomUUID().toString();
        log.info(
                "Opening position {}: {} {} x{} on {}",
                positionId,
                request.getDirection(),
                request.getSymbol(),
                request.getSize(),
                scope);

        // Step 2: market entry
        PlacedOrder entry;
        try {
            entry = exchangeClient.placeMarketOrder(
                    scope, protectiveOrderFactory.entry(request.getSymbol(), request.getDirection(), request.getSize()));
        } catch (ExchangeException e) {
            auditService.failure(positionId, AuditAction.POSITION_OPEN_FAILED, requestDetails(request), e.getMessage());
            log.error("Entry order failed for {} on {}: {}", request.getSymbol(), scope, e.getMessage());
            throw e;
        }
        BigDecimal entryPrice =
                entry.getAverageFillPrice() != null ? entry.getAverageFillPrice() : request.getEntryPrice();

        // Step 3: protective set, placed concurrently
        List<ProtectiveLeg> legs = List.of(
                new ProtectiveLeg(
                        ProtectiveOrderFactory.LABEL_TP1,
                        protectiveOrderFactory.takeProfit(
                                request.getSymbol(),
                                request.getDirection(),
                                request.getTp1Price(),
                                request.getTp1Size(),
                                ProtectiveOrderFactory.LABEL_TP1)),
                new ProtectiveLeg(
                        ProtectiveOrderFactory.LABEL_TP2,
                        protectiveOrderFactory.takeProfit(
                                request.getSymbol(),
                                request.getDirection(),
                                request.getTp2Price(),
                                request.getTp2Size(),
                                ProtectiveOrderFactory.LABEL_TP2)),
                new ProtectiveLeg(
                        ProtectiveOrderFactory.LABEL_STOP,
                        protectiveOrderFactory.stop(
                                request.getSymbol(),
                                request.getDirection(),
                                request.getStopPrice(),
                                ProtectiveOrderFactory.LABEL_STOP)));
        List<LegResult> legResults = placeAll(scope, legs);

        boolean allPlaced = legResults.stream().allMatch(LegResult::isSuccess);
        if (allPlaced) {
            Position position = buildPosition(positionId, request, entry.getOrderId(), entryPrice)
                    .tp1OrderId(legResults.get(0).getOrderId())
                    .tp2OrderId(legResults.get(1).getOrderId())
                    .stopOrderId(legResults.get(2).getOrderId())
                    .currentStopPrice(legs.get(2).spec().getTriggerPrice())
                    .build();
            return persist(position, AuditAction.POSITION_CREATED, legResults);
        }

        // Step 4: fall back to a lone stop, then compensate
        return protectWithSingleStop(positionId, request, scope, entry, entryPrice, legs, legResults);
    }

    private Position protectWithSingleStop(
            String positionId,
            PositionRequest request,
            ExchangeScope scope,
            PlacedOrder entry,
            BigDecimal entryPrice,
            List<ProtectiveLeg> legs,
            List<LegResult> legResults) {
        Map<String, Object> rollbackDetails = new LinkedHashMap<>();
        for (LegResult legResult : legResults) {
            rollbackDetails.put(
                    legResult.getLabel(),
                    legResult.isSuccess() ? legResult.getOrderId() : "FAILED: " + legResult.getFailureReason());
        }
        auditService.failure(
                positionId, AuditAction.PROTECTION_ROLLBACK, rollbackDetails, "Protective order placement failed");
        log.warn("Protective set incomplete for position {}: {}. Rolling back take-profits.", positionId, rollbackDetails);

        List<LegResult> takeProfits = legResults.subList(0, 2);
        LegResult stopLeg = legResults.get(2);
        if (stopLeg.isSuccess()) {
            rollbackPlacedLegs(positionId, scope, takeProfits);
            Position position = buildPosition(positionId, request, entry.getOrderId(), entryPrice)
                    .stopOrderId(stopLeg.getOrderId())
                    .currentStopPrice(legs.get(2).spec().getTriggerPrice())
                    .build();
            return persistStopOnly(position, AuditAction.STOP_ONLY_PROTECTION, legResults, rollbackDetails);
        }

        ConditionalOrderSpec emergencySpec = protectiveOrderFactory.stop(
                request.getSymbol(),
                request.getDirection(),
                request.getStopPrice(),
                ProtectiveOrderFactory.LABEL_EMERGENCY_STOP);
        String emergencyOrderId;
        try {
            emergencyOrderId = exchangeClient.placeConditionalOrder(scope, emergencySpec);
        } catch (ExchangeException e) {
            Map<String, Object> details = requestDetails(request);
            details.put("positionId", positionId);
            details.put("entryOrderId", entry.getOrderId());
            auditService.failure(positionId, AuditAction.UNPROTECTED_POSITION, details, e.getMessage());
            monitoringHealth.recordError(
                    ErrorSeverity.CRITICAL,
                    positionId,
                    String.format(
                            "Entry %s for %s on %s is UNPROTECTED: emergency stop failed: %s",
                            entry.getOrderId(), request.getSymbol(), scope, e.getMessage()));
            eventPublisherHelper.publishUnprotected(this, positionId, details);
            rollbackPlacedLegs(positionId, scope, takeProfits);
            throw new UnprotectedPositionException(
                    "Position " + positionId + " is open without any protective order", details, e);
        }
        rollbackPlacedLegs(positionId, scope, takeProfits);

        Position position = buildPosition(positionId, request, entry.getOrderId(), entryPrice)
                .stopOrderId(emergencyOrderId)
                .currentStopPrice(emergencySpec.getTriggerPrice())
                .build();
        return persistStopOnly(position, AuditAction.EMERGENCY_STOP_PLACED, legResults, rollbackDetails);
    }

    private Position persistStopOnly(
            Position position, AuditAction action, List<LegResult> legResults, Map<String, Object> rollbackDetails) {
        monitoringHealth.recordError(
                ErrorSeverity.WARNING, position.getId(), "Opened with a single stop only: " + rollbackDetails);
        Position stored = persist(position, action, legResults);
        eventPublisherHelper.publishEmergencyProtection(this, stored, rollbackDetails);
        return stored;
    }

    /**
     * Places all legs concurrently and waits for every outcome. Each leg is attempted
     * regardless of how the others fare.
     */
    List<LegResult> placeAll(ExchangeScope scope, List<ProtectiveLeg> legs) {
        List<CompletableFuture<LegResult>> futures = new ArrayList<>();
        for (ProtectiveLeg leg : legs) {
            futures.add(CompletableFuture.supplyAsync(() -> placeLeg(scope, leg), protectionExecutor));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private LegResult placeLeg(ExchangeScope scope, ProtectiveLeg leg) {
        try {
            String orderId = exchangeClient.placeConditionalOrder(scope, leg.spec());
            log.info("{} order placed: id={}, trigger={}", leg.label(), orderId, leg.spec().getTriggerPrice());
            return LegResult.success(leg.label(), orderId);
        } catch (ExchangeException e) {
            log.error("{} order placement failed for {}: {}", leg.label(), leg.spec().getSymbol(), e.getMessage());
            return LegResult.failed(leg.label(), e.getMessage());
        }
    }

    /**
     * Cancels every leg that was placed. A failed cancel is logged; the order is reduce-only
     * and cannot increase exposure.
     */
    void rollbackPlacedLegs(String positionId, ExchangeScope scope, List<LegResult> legResults) {
        for (LegResult legResult : legResults) {
            if (!legResult.isSuccess()) {
                continue;
            }
            try {
                exchangeClient.cancelConditionalOrder(scope, legResult.getOrderId());
                log.info("Rollback of {} order {} successful", legResult.getLabel(), legResult.getOrderId());
            } catch (ExchangeException e) {
                log.error(
                        "Rollback of {} order {} FAILED for position {}: {}",
                        legResult.getLabel(),
                        legResult.getOrderId(),
                        positionId,
                        e.getMessage());
            }
        }
    }

    private Position persist(Position position, AuditAction action, List<LegResult> legResults) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", position.getSymbol());
        details.put("direction", position.getDirection().name());
        details.put("size", position.getOriginalSize());
        details.put("entryOrderId", position.getEntryOrderId());
        details.put("entryPrice", position.getEntryPrice());
        details.put("tp1OrderId", position.getTp1OrderId());
        details.put("tp2OrderId", position.getTp2OrderId());
        details.put("stopOrderId", position.getStopOrderId());
        details.put("stopPrice", position.getCurrentStopPrice());
        details.put("legs", legResults.size());
        auditService.success(position.getId(), action, details);

        LocalDateTime now = position.getCreatedAt();
        TimeTracking timeTracking = TimeTracking.builder()
                .positionId(position.getId())
                .createdAt(now)
                .expiresAt(now.plusHours(lifecycleSettings.getMaxPositionAgeHours()))
                .warningSent(false)
                .forceCloseAttempted(false)
                .status(TrackingStatus.ACTIVE)
                .updatedAt(now)
                .build();
        Position stored = positionStore.create(position, timeTracking);

        if (action == AuditAction.POSITION_CREATED) {
            eventPublisherHelper.publishOpened(this, stored);
        }
        return stored;
    }

    public static String openKey(String symbol, ExchangeScope scope) {
        return "open:" + symbol + "|" + scope.getCredentialId() + "|" + scope.getMarket();
    }

    private static BusinessException duplicate(String symbol, ExchangeScope scope, String format) {
        return new BusinessException(
                ErrorCode.CONFLICT,
                String.format(format, symbol, scope),
                Map.of("symbol", symbol, "scope", scope.toString()));
    }

    private Position.PositionBuilder buildPosition(
            String positionId, PositionRequest request, String entryOrderId, BigDecimal entryPrice) {
        LocalDateTime now = LocalDateTime.now();
        return Position.builder()
                .id(positionId)
                .symbol(request.getSymbol())
                .direction(request.getDirection())
                .originalSize(request.getSize())
                .entryPrice(entryPrice)
                .entryOrderId(entryOrderId)
                .tp1Size(request.getTp1Size())
                .tp2Size(request.getTp2Size())
                .runnerSize(request.getSize() - request.getTp1Size() - request.getTp2Size())
                .phase(PositionPhase.INITIAL)
                .remainingSize(request.getSize())
                .realizedPnl(BigDecimal.ZERO)
                .originalStopPrice(request.getStopPrice())
                .tp1Price(request.getTp1Price())
                .tp2Price(request.getTp2Price())
                .credentialId(request.getCredentialId())
                .market(request.getMarket())
                .createdAt(now)
                .updatedAt(now);
    }

    /**
     * Checks sizes and that the levels sit on the right side of the entry for the direction.
     */
    void validate(PositionRequest request) {
        Map<String, Object> errors = new LinkedHashMap<>();
        if (isBlank(request.getSymbol())) {
            errors.put("symbol", "must not be blank");
        }
        if (isBlank(request.getCredentialId())) {
            errors.put("credentialId", "must not be blank");
        }
        if (isBlank(request.getMarket())) {
            errors.put("market", "must not be blank");
        }
        if (request.getDirection() == null) {
            errors.put("direction", "must not be null");
        }
        if (request.getSize() <= 0) {
            errors.put("size", "must be positive");
        }
        if (request.getTp1Size() <= 0 || request.getTp2Size() <= 0) {
            errors.put("tierSizes", "tp1Size and tp2Size must be positive");
        } else if (request.getTp1Size() + request.getTp2Size() > request.getSize()) {
            errors.put("tierSizes", "tp1Size + tp2Size must not exceed size");
        }
        if (!isPositive(request.getEntryPrice())
                || !isPositive(request.getStopPrice())
                || !isPositive(request.getTp1Price())
                || !isPositive(request.getTp2Price())) {
            errors.put("prices", "entry, stop, tp1 and tp2 prices must be positive");
        } else if (request.getDirection() != null) {
            validateLevels(request, errors);
        }

        if (!errors.isEmpty()) {
            throw new BusinessException("Invalid position request", errors);
        }
    }

    private void validateLevels(PositionRequest request, Map<String, Object> errors) {
        BigDecimal entry = request.getEntryPrice();
        boolean isLong = request.getDirection() == Direction.LONG;
        int stopSide = request.getStopPrice().compareTo(entry);
        int tp1Side = request.getTp1Price().compareTo(entry);
        int tp2VsTp1 = request.getTp2Price().compareTo(request.getTp1Price());

        if (isLong ? stopSide >= 0 : stopSide <= 0) {
            errors.put("stopPrice", isLong ? "must be below entry for LONG" : "must be above entry for SHORT");
        }
        if (isLong ? tp1Side <= 0 : tp1Side >= 0) {
            errors.put("tp1Price", isLong ? "must be above entry for LONG" : "must be below entry for SHORT");
        }
        if (isLong ? tp2VsTp1 < 0 : tp2VsTp1 > 0) {
            errors.put("tp2Price", "must not be closer to entry than tp1Price");
        }
    }

    private Map<String, Object> requestDetails(PositionRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", request.getSymbol());
        details.put("direction", String.valueOf(request.getDirection()));
        details.put("size", request.getSize());
        details.put("scope", request.scope().toString());
        return details;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    record ProtectiveLeg(String label, ConditionalOrderSpec spec) {}

    /** Result of placing one protective order. */
    @lombok.Data
    @lombok.Builder
    public static class LegResult {
        private String label;
        private boolean success;
        private String orderId;
        private String failureReason;

        public static LegResult success(String label, String orderId) {
            return LegResult.builder().label(label).success(true).orderId(orderId).build();
        }

        public static LegResult failed(String label, String reason) {
            return LegResult.builder()
                    .label(label)
                    .success(false)
                    .failureReason(reason)
                    .build();
        }
    }
}
