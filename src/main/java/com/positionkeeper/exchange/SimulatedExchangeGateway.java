package com.positionkeeper.exchange;

import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.exception.ExchangeException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * In-process exchange for paper runs and tests.
 *
 * <p>Keeps one book per {@link ExchangeScope}: signed position sizes by symbol and the open
 * conditional orders. Nothing fills on its own; {@link #triggerConditionalOrder} and
 * {@link #closePosition} play the part of the market.
 *
 * <p>Fill behaviour when an order is triggered:
 * <ul>
 *   <li>closeAll orders (stops) flatten the symbol</li>
 *   <li>sized orders (take-profits) reduce the position by their size, never past zero</li>
 * </ul>
 *
 * <p>Placement of conditional orders can be rejected per label via {@link #rejectConditionalOrders}
 * to exercise the protective-order failure paths.
 *
 * <p>Active when {@code positionkeeper.exchange.mode=simulated} (the default).
 */
@Service
@ConditionalOnProperty(
        prefix = "positionkeeper.exchange",
        name = "mode",
        havingValue = "simulated",
        matchIfMissing = true)
public class SimulatedExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExchangeGateway.class);

    private final Map<ExchangeScope, ScopeBook> books = new ConcurrentHashMap<>();

    /** Last price per symbol, reported as the average fill price of market orders. */
    private final Map<String, BigDecimal> markPrices = new ConcurrentHashMap<>();

    private final Set<String> rejectedLabels = ConcurrentHashMap.newKeySet();
    private final AtomicLong orderSequence = new AtomicLong();

    @Override
    public List<RemotePosition> listPositions(ExchangeScope scope) {
        ScopeBook book = book(scope);
        List<RemotePosition> positions = new ArrayList<>();
        book.positions.forEach((symbol, size) -> {
            if (size != 0) {
                positions.add(RemotePosition.builder().symbol(symbol).size(size).build());
            }
        });
        log.debug("Simulated listPositions for {}: {}", scope, positions.size());
        return positions;
    }

    @Override
    public List<RemoteConditionalOrder> listConditionalOrders(ExchangeScope scope) {
        List<RemoteConditionalOrder> orders = new ArrayList<>();
        book(scope).openOrders.forEach((id, spec) -> orders.add(RemoteConditionalOrder.builder()
                .id(id)
                .symbol(spec.getSymbol())
                .triggerPrice(spec.getTriggerPrice())
                .build()));
        log.debug("Simulated listConditionalOrders for {}: {}", scope, orders.size());
        return orders;
    }

    @Override
    public String placeConditionalOrder(ExchangeScope scope, ConditionalOrderSpec spec) {
        if (spec.getLabel() != null && rejectedLabels.contains(spec.getLabel())) {
            throw new ExchangeException("Simulated rejection of " + spec.getLabel() + " order for " + spec.getSymbol());
        }
        if (spec.getTriggerPrice() == null || spec.getTriggerPrice().signum() <= 0) {
            throw new ExchangeException("Invalid trigger price: " + spec.getTriggerPrice());
        }
        String orderId = "SIM-C-" + orderSequence.incrementAndGet();
        book(scope).openOrders.put(orderId, spec);
        log.debug(
                "Simulated conditional order placed: id={}, label={}, symbol={}, trigger={} {}",
                orderId,
                spec.getLabel(),
                spec.getSymbol(),
                spec.getTriggerRule(),
                spec.getTriggerPrice());
        return orderId;
    }

    @Override
    public void cancelConditionalOrder(ExchangeScope scope, String orderId) {
        ConditionalOrderSpec removed = book(scope).openOrders.remove(orderId);
        if (removed == null) {
            throw new ExchangeException("Order not found: " + orderId);
        }
        log.debug("Simulated conditional order cancelled: id={}", orderId);
    }

    @Override
    public PlacedOrder placeMarketOrder(ExchangeScope scope, MarketOrderSpec spec) {
        if (spec.getSize() <= 0) {
            throw new ExchangeException("Invalid market order size: " + spec.getSize());
        }
        ScopeBook book = book(scope);
        int signedSize = spec.getDirection() == Direction.LONG ? spec.getSize() : -spec.getSize();
        book.positions.merge(spec.getSymbol(), signedSize, (current, delta) -> {
            int next = current + delta;
            if (spec.isReduceOnly() && Integer.signum(next) != Integer.signum(current)) {
                return 0;
            }
            return next;
        });
        String orderId = "SIM-M-" + orderSequence.incrementAndGet();
        log.debug(
                "Simulated market order filled: id={}, symbol={}, {} {}",
                orderId,
                spec.getSymbol(),
                spec.getDirection(),
                spec.getSize());
        return PlacedOrder.builder()
                .orderId(orderId)
                .averageFillPrice(markPrices.get(spec.getSymbol()))
                .build();
    }

    // ---- Simulation controls ----

    public void setMarkPrice(String symbol, BigDecimal price) {
        markPrices.put(symbol, price);
    }

    /**
     * Simulates the market crossing an order's trigger: the order leaves the open set and
     * its size comes off the position.
     */
    public void triggerConditionalOrder(ExchangeScope scope, String orderId) {
        ScopeBook book = book(scope);
        ConditionalOrderSpec spec = book.openOrders.remove(orderId);
        if (spec == null) {
            throw new IllegalArgumentException("No open conditional order " + orderId);
        }
        book.positions.computeIfPresent(spec.getSymbol(), (symbol, current) -> {
            if (spec.isCloseAll()) {
                return 0;
            }
            int reduced = Math.max(0, Math.abs(current) - spec.getSize());
            return current > 0 ? reduced : -reduced;
        });
        log.debug("Simulated trigger of order {} ({})", orderId, spec.getLabel());
    }

    /** Flattens a symbol as if closed from outside (another client, liquidation). */
    public void closePosition(ExchangeScope scope, String symbol) {
        book(scope).positions.put(symbol, 0);
    }

    public void rejectConditionalOrders(String label) {
        rejectedLabels.add(label);
    }

    public void clearRejections() {
        rejectedLabels.clear();
    }

    private ScopeBook book(ExchangeScope scope) {
        return books.computeIfAbsent(scope, s -> new ScopeBook());
    }

    private static final class ScopeBook {
        private final Map<String, Integer> positions = new ConcurrentHashMap<>();
        private final Map<String, ConditionalOrderSpec> openOrders = new ConcurrentHashMap<>();
    }
}
