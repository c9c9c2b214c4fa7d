package com.positionkeeper.event;

import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ReconciliationCycleResult;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around Spring's {@link ApplicationEventPublisher} for the lifecycle events,
 * so call sites read {@code eventPublisherHelper.publishOpened(this, position)}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Position lifecycle ----

    public void publishOpened(Object source, Position position) {
        publish(source, PositionLifecycleEventType.OPENED, position, Map.of());
    }

    public void publishEmergencyProtection(Object source, Position position, Map<String, Object> details) {
        publish(source, PositionLifecycleEventType.EMERGENCY_PROTECTION, position, details);
    }

    public void publishUnprotected(Object source, String positionId, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new PositionLifecycleEvent(source, PositionLifecycleEventType.UNPROTECTED, positionId, null, details));
    }

    public void publishFillApplied(Object source, Position position, Map<String, Object> details) {
        publish(source, PositionLifecycleEventType.FILL_APPLIED, position, details);
    }

    public void publishStopReplaced(Object source, Position position, Map<String, Object> details) {
        publish(source, PositionLifecycleEventType.STOP_REPLACED, position, details);
    }

    public void publishClosedRemotely(Object source, Position position) {
        publish(source, PositionLifecycleEventType.CLOSED_REMOTELY, position, Map.of());
    }

    public void publishExpiryWarning(Object source, Position position, Map<String, Object> details) {
        publish(source, PositionLifecycleEventType.EXPIRY_WARNING, position, details);
    }

    public void publishForceClosed(Object source, Position position, Map<String, Object> details) {
        publish(source, PositionLifecycleEventType.FORCE_CLOSED, position, details);
    }

    // ---- Reconciliation ----

    public void publishReconciliationCycle(Object source, ReconciliationCycleResult result) {
        applicationEventPublisher.publishEvent(new ReconciliationCycleEvent(source, result));
    }

    private void publish(
            Object source, PositionLifecycleEventType type, Position position, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new PositionLifecycleEvent(source, type, position.getId(), position, details));
    }
}
