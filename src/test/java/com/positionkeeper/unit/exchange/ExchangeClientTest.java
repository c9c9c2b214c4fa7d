package com.positionkeeper.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.exception.ErrorCode;
import com.positionkeeper.exception.ExchangeException;
import com.positionkeeper.exception.ExchangeTimeoutException;
import com.positionkeeper.exchange.ExchangeClient;
import com.positionkeeper.exchange.ExchangeGateway;
import com.positionkeeper.exchange.RemotePosition;
import com.positionkeeper.observability.LifecycleMetricsService;
import com.positionkeeper.store.PositionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExchangeClient: the call bound, error normalisation and call metrics.
 */
class ExchangeClientTest {

    private static final ExchangeScope SCOPE = ExchangeScope.of("cred-1", "USDT");

    private ExchangeGateway exchangeGateway;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private ExchangeClient exchangeClient;

    @BeforeEach
    void setUp() {
        exchangeGateway = mock(ExchangeGateway.class);
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newSingleThreadExecutor();
        exchangeClient = new ExchangeClient(
                exchangeGateway, executor, new LifecycleMetricsService(meterRegistry, mock(PositionStore.class)), 200);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Successful call returns the gateway result and records a success timing")
    void success() {
        when(exchangeGateway.listPositions(SCOPE))
                .thenReturn(List.of(RemotePosition.builder().symbol("BTC-PERP").size(3).build()));

        assertThat(exchangeClient.listPositions(SCOPE)).hasSize(1);
        assertThat(meterRegistry.get("exchange.call")
                        .tag("operation", "listPositions")
                        .tag("outcome", "success")
                        .timer()
                        .count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Call that does not answer in time becomes EXCHANGE_TIMEOUT")
    void timeout() {
        when(exchangeGateway.listConditionalOrders(SCOPE)).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return List.of();
        });

        assertThatThrownBy(() -> exchangeClient.listConditionalOrders(SCOPE))
                .isInstanceOf(ExchangeTimeoutException.class)
                .hasMessageContaining("listConditionalOrders")
                .satisfies(e -> assertThat(((ExchangeException) e).getErrorCode()).isEqualTo(ErrorCode.EXCHANGE_TIMEOUT));
        assertThat(meterRegistry.get("exchange.call").tag("outcome", "failure").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Saturated executor fails the call at once instead of running it on the caller")
    void saturatedExecutorRejects() throws Exception {
        CountDownLatch busy = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ThreadPoolExecutor saturated =
                new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS, new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
        ExchangeClient boundedClient = new ExchangeClient(
                exchangeGateway, saturated, new LifecycleMetricsService(meterRegistry, mock(PositionStore.class)), 200);
        try {
            saturated.execute(() -> {
                busy.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> boundedClient.listPositions(SCOPE))
                    .isInstanceOf(ExchangeException.class)
                    .hasMessageContaining("saturated")
                    .hasCauseInstanceOf(RejectedExecutionException.class);
            verify(exchangeGateway, never()).listPositions(SCOPE);
            assertThat(meterRegistry.get("exchange.call").tag("outcome", "failure").timer().count()).isEqualTo(1);
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    @Test
    @DisplayName("Exchange rejection is rethrown unchanged")
    void rejectionPassesThrough() {
        ExchangeException rejection = new ExchangeException("insufficient margin");
        when(exchangeGateway.placeConditionalOrder(SCOPE, null)).thenThrow(rejection);

        assertThatThrownBy(() -> exchangeClient.placeConditionalOrder(SCOPE, null)).isSameAs(rejection);
    }

    @Test
    @DisplayName("Unexpected gateway failure is wrapped as an ExchangeException")
    void unexpectedFailureWrapped() {
        when(exchangeGateway.listPositions(SCOPE)).thenThrow(new IllegalStateException("socket closed"));

        assertThatThrownBy(() -> exchangeClient.listPositions(SCOPE))
                .isInstanceOf(ExchangeException.class)
                .hasMessageContaining("listPositions")
                .hasMessageContaining("socket closed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
