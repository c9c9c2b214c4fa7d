package com.positionkeeper.exchange;

import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.exception.ExchangeException;
import java.util.List;

/**
 * Abstraction over the exchange's order-entry and query endpoints.
 *
 * <p>All calls are synchronous request/response scoped by credential + settlement market.
 * The exchange pushes nothing: fills are only visible as orders disappearing from
 * {@link #listConditionalOrders} and positions shrinking in {@link #listPositions}.
 *
 * <p>Implementations must not retry internally; the core decides what to retry and when.
 * Core components reach the gateway only through {@link ExchangeClient}, which bounds every call.
 */
public interface ExchangeGateway {

    // ---- Queries ----

    /**
     * Returns the open positions for the scope. Flat positions may be omitted or reported with size 0.
     *
     * @throws ExchangeException if the exchange API call fails
     */
    List<RemotePosition> listPositions(ExchangeScope scope);

    /**
     * Returns every open (not yet triggered, not cancelled) conditional order for the scope.
     *
     * @throws ExchangeException if the exchange API call fails
     */
    List<RemoteConditionalOrder> listConditionalOrders(ExchangeScope scope);

    // ---- Orders ----

    /**
     * Places a price-triggered order.
     *
     * @return the exchange order id
     * @throws ExchangeException if the order is rejected or the call fails
     */
    String placeConditionalOrder(ExchangeScope scope, ConditionalOrderSpec spec);

    /**
     * Cancels an open conditional order.
     *
     * @throws ExchangeException if the order is unknown, already gone, or the call fails
     */
    void cancelConditionalOrder(ExchangeScope scope, String orderId);

    /**
     * Places a market order.
     *
     * @throws ExchangeException if the order is rejected or the call fails
     */
    PlacedOrder placeMarketOrder(ExchangeScope scope, MarketOrderSpec spec);
}
