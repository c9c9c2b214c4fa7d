package com.positionkeeper.reconciliation;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.exception.ExchangeException;
import com.positionkeeper.exchange.ExchangeClient;
import com.positionkeeper.exchange.RemoteConditionalOrder;
import com.positionkeeper.exchange.RemotePosition;
import com.positionkeeper.service.AuditService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cancels conditional orders left behind on symbols that have no open position, for example
 * take-profits of a position that was closed by hand on the exchange.
 */
@Service
public class OrphanedOrderCleanupService {

    private static final Logger log = LoggerFactory.getLogger(OrphanedOrderCleanupService.class);

    private final ExchangeClient exchangeClient;
    private final AuditService auditService;

    public OrphanedOrderCleanupService(ExchangeClient exchangeClient, AuditService auditService) {
        this.exchangeClient = exchangeClient;
        this.auditService = auditService;
    }

    /**
     * Cancels every open conditional order in {@code scope} whose symbol has no open remote position.
     *
     * @throws ExchangeException if either list call fails; nothing is cancelled in that case
     */
    public OrphanCleanupResult cleanup(ExchangeScope scope) {
        Set<String> openSymbols = exchangeClient.listPositions(scope).stream()
                .filter(position -> position.getSize() != 0)
                .map(RemotePosition::getSymbol)
                .collect(Collectors.toSet());
        List<RemoteConditionalOrder> openOrders = exchangeClient.listConditionalOrders(scope);

        OrphanCleanupResult result = OrphanCleanupResult.builder()
                .scope(scope.toString())
                .ordersChecked(openOrders.size())
                .build();

        for (RemoteConditionalOrder order : openOrders) {
            if (openSymbols.contains(order.getSymbol())) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("orderId", order.getId());
            details.put("symbol", order.getSymbol());
            details.put("scope", scope.toString());
            try {
                exchangeClient.cancelConditionalOrder(scope, order.getId());
                result.getCancelledOrderIds().add(order.getId());
                auditService.success(null, AuditAction.ORPHAN_ORDER_CANCELLED, details);
            } catch (ExchangeException e) {
                result.getFailedOrderIds().put(order.getId(), e.getMessage());
                auditService.failure(null, AuditAction.ORPHAN_ORDER_CANCELLED, details, e.getMessage());
            }
        }

        log.info(
                "Orphaned order cleanup on {}: checked={}, cancelled={}, failed={}",
                scope,
                result.getOrdersChecked(),
                result.getCancelledOrderIds().size(),
                result.getFailedOrderIds().size());
        return result;
    }
}
