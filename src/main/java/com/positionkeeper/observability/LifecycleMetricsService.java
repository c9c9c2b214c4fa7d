package com.positionkeeper.observability;

import com.positionkeeper.event.PositionLifecycleEvent;
import com.positionkeeper.event.ReconciliationCycleEvent;
import com.positionkeeper.store.PositionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the Micrometer metrics of the lifecycle engine:
 * <ul>
 *   <li><b>positions.opened</b>, <b>positions.emergency.protected</b>, <b>positions.unprotected</b></li>
 *   <li><b>fills.applied</b> (tag {@code type}): fills that changed a position</li>
 *   <li><b>stops.replaced</b>, <b>positions.closed.remotely</b>, <b>positions.force.closed</b></li>
 *   <li><b>reconciliation.cycles</b> and <b>reconciliation.group.errors</b></li>
 *   <li><b>exchange.call</b> timer (tags {@code operation}, {@code outcome})</li>
 *   <li><b>positions.active</b> gauge, read from the store on scrape</li>
 * </ul>
 */
@Service
public class LifecycleMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter positionsOpenedCounter;
    private final Counter emergencyProtectionCounter;
    private final Counter unprotectedCounter;
    private final Counter stopsReplacedCounter;
    private final Counter closedRemotelyCounter;
    private final Counter forceClosedCounter;
    private final Counter reconciliationCycleCounter;
    private final Counter reconciliationGroupErrorCounter;

    public LifecycleMetricsService(MeterRegistry meterRegistry, PositionStore positionStore) {
        this.meterRegistry = meterRegistry;

        this.positionsOpenedCounter = Counter.builder("positions.opened")
                .description("Positions opened with the full protective set")
                .register(meterRegistry);
        this.emergencyProtectionCounter = Counter.builder("positions.emergency.protected")
                .description("Positions left with only an emergency stop after a protective placement failure")
                .register(meterRegistry);
        this.unprotectedCounter = Counter.builder("positions.unprotected")
                .description("Entries that could not be protected by any stop")
                .register(meterRegistry);
        this.stopsReplacedCounter = Counter.builder("stops.replaced")
                .description("Stop orders moved to break-even or trailing levels")
                .register(meterRegistry);
        this.closedRemotelyCounter = Counter.builder("positions.closed.remotely")
                .description("Positions completed because the exchange no longer reports them")
                .register(meterRegistry);
        this.forceClosedCounter = Counter.builder("positions.force.closed")
                .description("Positions force closed by the time box or an operator")
                .register(meterRegistry);
        this.reconciliationCycleCounter = Counter.builder("reconciliation.cycles")
                .description("Reconciliation cycles that ran")
                .register(meterRegistry);
        this.reconciliationGroupErrorCounter = Counter.builder("reconciliation.group.errors")
                .description("Credential+market groups skipped because a remote call failed")
                .register(meterRegistry);

        meterRegistry.gauge("positions.active", positionStore, store -> (double) store.countActive());
    }

    @EventListener
    @Order(20)
    public void onLifecycleEvent(PositionLifecycleEvent event) {
        switch (event.getEventType()) {
            case OPENED -> positionsOpenedCounter.increment();
            case EMERGENCY_PROTECTION -> emergencyProtectionCounter.increment();
            case UNPROTECTED -> unprotectedCounter.increment();
            case STOP_REPLACED -> stopsReplacedCounter.increment();
            case CLOSED_REMOTELY -> closedRemotelyCounter.increment();
            case FORCE_CLOSED -> forceClosedCounter.increment();
            case FILL_APPLIED -> meterRegistry
                    .counter("fills.applied", "type", String.valueOf(event.getDetails().get("fillType")))
                    .increment();
            default -> {
                // no metric
            }
        }
    }

    @EventListener
    @Order(20)
    public void onReconciliationCycle(ReconciliationCycleEvent event) {
        reconciliationCycleCounter.increment();
        int groupErrors = event.getResult().getGroupErrors().size();
        if (groupErrors > 0) {
            reconciliationGroupErrorCounter.increment(groupErrors);
        }
    }

    /** Records the latency of one exchange call. */
    public void recordExchangeCall(String operation, boolean success, long elapsedNanos) {
        Timer.builder("exchange.call")
                .description("Latency of exchange gateway calls")
                .tag("operation", operation)
                .tag("outcome", success ? "success" : "failure")
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }
}
