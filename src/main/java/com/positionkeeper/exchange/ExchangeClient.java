package com.positionkeeper.exchange;

import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.exception.ExchangeException;
import com.positionkeeper.exception.ExchangeTimeoutException;
import com.positionkeeper.observability.LifecycleMetricsService;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Bounded-time access to the {@link ExchangeGateway}.
 *
 * <p>Each call runs on the exchange executor and is abandoned after
 * {@code positionkeeper.exchange.call-timeout-ms}. A timeout surfaces as
 * {@link ExchangeTimeoutException}; any other failure as {@link ExchangeException}. A call the
 * saturated exchange executor refuses fails at once instead of running unbounded on the caller.
 * Callers in the polling loops treat both as "no information this cycle".
 */
@Component
public class ExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(ExchangeClient.class);

    private final ExchangeGateway exchangeGateway;
    private final Executor exchangeExecutor;
    private final LifecycleMetricsService lifecycleMetricsService;
    private final long callTimeoutMs;

    public ExchangeClient(
            ExchangeGateway exchangeGateway,
            @Qualifier("exchangeExecutor") Executor exchangeExecutor,
            LifecycleMetricsService lifecycleMetricsService,
            @Value("${positionkeeper.exchange.call-timeout-ms:10000}") long callTimeoutMs) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeExecutor = exchangeExecutor;
        this.lifecycleMetricsService = lifecycleMetricsService;
        this.callTimeoutMs = callTimeoutMs;
    }

    public List<RemotePosition> listPositions(ExchangeScope scope) {
        return call("listPositions", scope, () -> exchangeGateway.listPositions(scope));
    }

    public List<RemoteConditionalOrder> listConditionalOrders(ExchangeScope scope) {
        return call("listConditionalOrders", scope, () -> exchangeGateway.listConditionalOrders(scope));
    }

    public String placeConditionalOrder(ExchangeScope scope, ConditionalOrderSpec spec) {
        return call("placeConditionalOrder", scope, () -> exchangeGateway.placeConditionalOrder(scope, spec));
    }

    public void cancelConditionalOrder(ExchangeScope scope, String orderId) {
        call("cancelConditionalOrder", scope, () -> {
            exchangeGateway.cancelConditionalOrder(scope, orderId);
            return null;
        });
    }

    public PlacedOrder placeMarketOrder(ExchangeScope scope, MarketOrderSpec spec) {
        return call("placeMarketOrder", scope, () -> exchangeGateway.placeMarketOrder(scope, spec));
    }

    private <T> T call(String operation, ExchangeScope scope, Supplier<T> remoteCall) {
        long startNanos = System.nanoTime();
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(remoteCall, exchangeExecutor);
        } catch (RejectedExecutionException e) {
            lifecycleMetricsService.recordExchangeCall(operation, false, System.nanoTime() - startNanos);
            log.warn("Exchange call {} for {} rejected: exchange executor saturated", operation, scope);
            throw new ExchangeException(
                    String.format("Exchange call %s for %s rejected: exchange executor saturated", operation, scope), e);
        }
        try {
            T result = future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
            lifecycleMetricsService.recordExchangeCall(operation, true, System.nanoTime() - startNanos);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            lifecycleMetricsService.recordExchangeCall(operation, false, System.nanoTime() - startNanos);
            log.warn("Exchange call {} for {} timed out after {}ms", operation, scope, callTimeoutMs);
            throw new ExchangeTimeoutException(operation, callTimeoutMs, e);
        } catch (ExecutionException e) {
            lifecycleMetricsService.recordExchangeCall(operation, false, System.nanoTime() - startNanos);
            Throwable cause = e.getCause();
            if (cause instanceof ExchangeException exchangeException) {
                throw exchangeException;
            }
            throw new ExchangeException(
                    String.format("Exchange call %s for %s failed: %s", operation, scope, cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException("Interrupted during exchange call " + operation, e);
        }
    }
}
