package com.positionkeeper.event;

import com.positionkeeper.domain.model.Position;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published whenever a managed position changes in a way an operator may care about.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>LifecycleMetricsService: counters per event type</li>
 *   <li>UnprotectedPositionAlertHandler: CRITICAL logging for UNPROTECTED</li>
 * </ul>
 */
public class PositionLifecycleEvent extends ApplicationEvent {

    private final PositionLifecycleEventType eventType;
    private final String positionId;
    private final Position position;
    private final Map<String, Object> details;

    /**
     * @param source     the component publishing this event
     * @param eventType  what happened
     * @param positionId id of the position concerned
     * @param position   state after the change, null when nothing was persisted
     * @param details    extra context (fill type, prices, order ids)
     */
    public PositionLifecycleEvent(
            Object source,
            PositionLifecycleEventType eventType,
            String positionId,
            Position position,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.positionId = positionId;
        this.position = position;
        this.details = details != null ? details : Map.of();
    }

    public PositionLifecycleEventType getEventType() {
        return eventType;
    }

    public String getPositionId() {
        return positionId;
    }

    public Position getPosition() {
        return position;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
