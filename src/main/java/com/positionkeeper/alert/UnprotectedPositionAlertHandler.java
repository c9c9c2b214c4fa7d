package com.positionkeeper.alert;

import com.positionkeeper.event.PositionLifecycleEvent;
import com.positionkeeper.event.PositionLifecycleEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Turns protection failures into operator alerts.
 *
 * <ul>
 *   <li>UNPROTECTED: CRITICAL, capital is on the exchange without any stop</li>
 *   <li>EMERGENCY_PROTECTION: WARNING, stop only, take-profits missing</li>
 * </ul>
 */
@Component
public class UnprotectedPositionAlertHandler {

    private static final Logger log = LoggerFactory.getLogger(UnprotectedPositionAlertHandler.class);

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onLifecycleEvent(PositionLifecycleEvent event) {
        if (event.getEventType() == PositionLifecycleEventType.UNPROTECTED) {
            log.error(
                    "ALERT CRITICAL: position {} is open WITHOUT protective orders, manual action required: {}",
                    event.getPositionId(),
                    event.getDetails());
        } else if (event.getEventType() == PositionLifecycleEventType.EMERGENCY_PROTECTION) {
            log.warn(
                    "ALERT WARNING: position {} ({}) protected by emergency stop only: {}",
                    event.getPositionId(),
                    event.getPosition() != null ? event.getPosition().getSymbol() : "?",
                    event.getDetails());
        }
    }
}
