package com.positionkeeper.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.Direction;
import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.enums.FillType;
import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.model.LifecycleSettings;
import com.positionkeeper.domain.model.OrderFillEvent;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.observability.MonitoringHealth;
import com.positionkeeper.oms.FillOutcome;
import com.positionkeeper.oms.FillProcessor;
import com.positionkeeper.oms.ProtectiveOrderManager;
import com.positionkeeper.oms.ProtectiveOrderManager.StopReplacementResult;
import com.positionkeeper.oms.StopPriceCalculator;
import com.positionkeeper.service.AuditService;
import com.positionkeeper.store.PositionStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for FillProcessor covering the phase rules per fill type, stop migration,
 * and the two idempotency layers.
 */
class FillProcessorTest {

    private PositionStore positionStore;
    private ProtectiveOrderManager protectiveOrderManager;
    private AuditService auditService;
    private EventPublisherHelper eventPublisherHelper;
    private MonitoringHealth monitoringHealth;
    private FillProcessor fillProcessor;

    @BeforeEach
    void setUp() {
        positionStore = mock(PositionStore.class);
        protectiveOrderManager = mock(ProtectiveOrderManager.class);
        auditService = mock(AuditService.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        monitoringHealth = mock(MonitoringHealth.class);

        fillProcessor = new FillProcessor(
                positionStore,
                protectiveOrderManager,
                new StopPriceCalculator(LifecycleSettings.builder().build()),
                auditService,
                eventPublisherHelper,
                monitoringHealth);

        when(protectiveOrderManager.replaceStop(any(), any(), any()))
                .thenReturn(StopReplacementResult.builder().replaced(true).build());
    }

    private Position position(PositionPhase phase, int remaining) {
        return Position.builder()
                .id("P1")
                .symbol("BTC-PERP")
                .direction(Direction.LONG)
                .originalSize(10)
                .entryPrice(new BigDecimal("50000"))
                .tp1Size(5)
                .tp2Size(3)
                .runnerSize(2)
                .tp1OrderId("TP1-1")
                .tp2OrderId("TP2-1")
                .stopOrderId("SL-1")
                .phase(phase)
                .remainingSize(remaining)
                .realizedPnl(BigDecimal.ZERO)
                .originalStopPrice(new BigDecimal("49000"))
                .currentStopPrice(new BigDecimal("49000"))
                .credentialId("cred-1")
                .market("USDT")
                .build();
    }

    private OrderFillEvent fill(FillType type, String orderId, int size, String price) {
        return OrderFillEvent.builder()
                .positionId("P1")
                .orderId(orderId)
                .fillType(type)
                .fillSize(size)
                .fillPrice(price != null ? new BigDecimal(price) : null)
                .filledAt(LocalDateTime.now())
                .build();
    }

    private void givenPosition(Position position) {
        when(positionStore.getOrThrow("P1")).thenReturn(position);
    }

    @Nested
    @DisplayName("Take-profit tiers")
    class TakeProfitTiers {

        @Test
        @DisplayName("tp1 of 5 at 50750 leaves 5, accrues 3750 and moves the stop to break-even 50025")
        void tp1Fill() {
            OrderFillEvent fill = fill(FillType.TP1, "TP1-1", 5, "50750");
            when(positionStore.recordFill(fill)).thenReturn(true);
            givenPosition(position(PositionPhase.INITIAL, 10));
            Position updated = position(PositionPhase.TP1_FILLED, 5);
            when(positionStore.applyPhaseTransition(
                            eq("P1"), eq(PositionPhase.TP1_FILLED), eq(5), any(BigDecimal.class), isNull()))
                    .thenReturn(updated);

            FillOutcome outcome = fillProcessor.process(fill);

            assertThat(outcome).isEqualTo(FillOutcome.APPLIED);
            verify(positionStore).applyPhaseTransition(
                    eq("P1"), eq(PositionPhase.TP1_FILLED), eq(5),
                    argThat(pnl -> pnl.compareTo(new BigDecimal("3750")) == 0), isNull());
            verify(protectiveOrderManager).replaceStop(
                    eq(updated),
                    argThat(price -> price.compareTo(new BigDecimal("50025")) == 0),
                    eq(AuditAction.SL_UPDATED_BREAK_EVEN));
            verify(positionStore).markFillProcessed("TP1-1");
            verify(auditService).success(eq("P1"), eq(AuditAction.TP1_FILLED), anyMap());
        }

        @Test
        @DisplayName("tp2 moves the stop to the trailing level")
        void tp2Fill() {
            OrderFillEvent fill = fill(FillType.TP2, "TP2-1", 3, "51500");
            when(positionStore.recordFill(fill)).thenReturn(true);
            Position tp1Filled = position(PositionPhase.TP1_FILLED, 5).toBuilder()
                    .currentStopPrice(new BigDecimal("50025"))
                    .build();
            givenPosition(tp1Filled);
            Position updated = tp1Filled.toBuilder().phase(PositionPhase.TP2_FILLED).remainingSize(2).build();
            when(positionStore.applyPhaseTransition(eq("P1"), eq(PositionPhase.TP2_FILLED), eq(2), any(), isNull()))
                    .thenReturn(updated);

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.APPLIED);

            verify(protectiveOrderManager).replaceStop(
                    eq(updated),
                    argThat(price -> price.compareTo(new BigDecimal("50985")) == 0),
                    eq(AuditAction.SL_UPDATED_TRAILING));
        }

        @Test
        @DisplayName("Tier that consumes everything completes the position instead of moving the stop")
        void tierClosesEverything() {
            OrderFillEvent fill = fill(FillType.TP2, "TP2-1", 3, "51500");
            when(positionStore.recordFill(fill)).thenReturn(true);
            givenPosition(position(PositionPhase.TP1_FILLED, 3));
            when(positionStore.applyPhaseTransition(
                            eq("P1"), eq(PositionPhase.COMPLETED), eq(0), any(), eq("all tiers filled")))
                    .thenReturn(position(PositionPhase.COMPLETED, 0));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.APPLIED);

            verify(protectiveOrderManager).cancelProtectiveOrders(any(Position.class));
            verify(protectiveOrderManager, never()).replaceStop(any(), any(), any());
        }

        @Test
        @DisplayName("Failed stop move is recorded as a warning and the fill still counts")
        void stopMoveFailure() {
            when(protectiveOrderManager.replaceStop(any(), any(), any()))
                    .thenReturn(StopReplacementResult.failed("SL-1", new BigDecimal("50025"), "rejected"));
            OrderFillEvent fill = fill(FillType.TP1, "TP1-1", 5, "50750");
            when(positionStore.recordFill(fill)).thenReturn(true);
            givenPosition(position(PositionPhase.INITIAL, 10));
            when(positionStore.applyPhaseTransition(any(), any(), any(), any(), any()))
                    .thenReturn(position(PositionPhase.TP1_FILLED, 5));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.APPLIED);

            verify(monitoringHealth).recordError(eq(ErrorSeverity.WARNING), eq("P1"), anyString());
        }
    }

    @Nested
    @DisplayName("Stop and manual fills")
    class StopAndManual {

        @Test
        @DisplayName("Stop fill zeroes the position as STOPPED_OUT and cancels leftover take-profits")
        void stopFill() {
            OrderFillEvent fill = fill(FillType.SL, "SL-1", 10, "49000");
            when(positionStore.recordFill(fill)).thenReturn(true);
            givenPosition(position(PositionPhase.INITIAL, 10));
            when(positionStore.applyPhaseTransition(
                            eq("P1"), eq(PositionPhase.STOPPED_OUT), eq(0), any(), eq("stop filled")))
                    .thenReturn(position(PositionPhase.STOPPED_OUT, 0));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.APPLIED);

            // The filled stop itself is not cancelled
            verify(protectiveOrderManager).cancelProtectiveOrders(argThat(p -> p.getStopOrderId() == null
                    && "TP1-1".equals(p.getTp1OrderId())));
            verify(positionStore).applyPhaseTransition(
                    eq("P1"), eq(PositionPhase.STOPPED_OUT), eq(0),
                    argThat(pnl -> pnl.compareTo(new BigDecimal("-10000")) == 0), eq("stop filled"));
        }

        @Test
        @DisplayName("Manual fill larger than the position floors at zero and completes it")
        void manualFloorsAtZero() {
            OrderFillEvent fill = fill(FillType.MANUAL, "MANUAL-1", 50, null);
            when(positionStore.recordFill(fill)).thenReturn(true);
            givenPosition(position(PositionPhase.TP1_FILLED, 5));
            when(positionStore.applyPhaseTransition(
                            eq("P1"), eq(PositionPhase.COMPLETED), eq(0), isNull(), eq("manually closed")))
                    .thenReturn(position(PositionPhase.COMPLETED, 0));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.APPLIED);

            verify(protectiveOrderManager).cancelProtectiveOrders(any(Position.class));
        }

        @Test
        @DisplayName("Partial manual fill keeps the phase")
        void manualPartial() {
            OrderFillEvent fill = fill(FillType.MANUAL, "MANUAL-1", 2, "50500");
            when(positionStore.recordFill(fill)).thenReturn(true);
            givenPosition(position(PositionPhase.INITIAL, 10));
            when(positionStore.applyPhaseTransition(eq("P1"), eq(PositionPhase.INITIAL), eq(8), any(), isNull()))
                    .thenReturn(position(PositionPhase.INITIAL, 8));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.APPLIED);

            verify(protectiveOrderManager, never()).cancelProtectiveOrders(any());
        }
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("Already processed order id is a duplicate with no effect")
        void duplicate() {
            OrderFillEvent fill = fill(FillType.TP1, "TP1-1", 5, "50750");
            when(positionStore.recordFill(fill)).thenReturn(false);
            OrderFillEvent recorded = fill(FillType.TP1, "TP1-1", 5, "50750");
            recorded.setProcessed(true);
            when(positionStore.findFill("TP1-1")).thenReturn(Optional.of(recorded));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.DUPLICATE);

            verify(positionStore, never()).applyPhaseTransition(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Recorded but unprocessed order id is resumed")
        void resumesUnprocessed() {
            OrderFillEvent fill = fill(FillType.TP1, "TP1-1", 5, "50750");
            when(positionStore.recordFill(fill)).thenReturn(false);
            when(positionStore.findFill("TP1-1")).thenReturn(Optional.of(fill(FillType.TP1, "TP1-1", 5, "50750")));
            givenPosition(position(PositionPhase.INITIAL, 10));
            when(positionStore.applyPhaseTransition(any(), any(), any(), any(), any()))
                    .thenReturn(position(PositionPhase.TP1_FILLED, 5));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.APPLIED);
        }

        @Test
        @DisplayName("tp2 while still INITIAL is ignored and marked processed")
        void phaseGuard() {
            OrderFillEvent fill = fill(FillType.TP2, "TP2-1", 3, "51500");
            when(positionStore.recordFill(fill)).thenReturn(true);
            givenPosition(position(PositionPhase.INITIAL, 10));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.IGNORED);

            verify(positionStore).markFillProcessed("TP2-1");
            verify(auditService).success(eq("P1"), eq(AuditAction.FILL_IGNORED), anyMap());
            verify(positionStore, never()).applyPhaseTransition(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Fill on a terminal position is ignored")
        void terminalIgnored() {
            OrderFillEvent fill = fill(FillType.SL, "SL-1", 10, "49000");
            when(positionStore.recordFill(fill)).thenReturn(true);
            givenPosition(position(PositionPhase.COMPLETED, 0));

            assertThat(fillProcessor.process(fill)).isEqualTo(FillOutcome.IGNORED);
        }

        @Test
        @DisplayName("Resumed tier whose transition was already written only completes the stop move")
        void resumeAfterTransition() {
            OrderFillEvent fill = fill(FillType.TP1, "TP1-1", 5, "50750");
            givenPosition(position(PositionPhase.TP1_FILLED, 5));

            assertThat(fillProcessor.resume(fill)).isEqualTo(FillOutcome.APPLIED);

            verify(positionStore, never()).applyPhaseTransition(any(), any(), any(), any(), any());
            verify(protectiveOrderManager).replaceStop(any(), any(), eq(AuditAction.SL_UPDATED_BREAK_EVEN));
            verify(positionStore).markFillProcessed("TP1-1");
        }
    }
}
