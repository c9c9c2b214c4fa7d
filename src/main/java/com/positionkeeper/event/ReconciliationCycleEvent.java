package com.positionkeeper.event;

import com.positionkeeper.domain.model.ReconciliationCycleResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every reconciliation cycle that actually ran.
 */
public class ReconciliationCycleEvent extends ApplicationEvent {

    private final ReconciliationCycleResult result;

    public ReconciliationCycleEvent(Object source, ReconciliationCycleResult result) {
        super(source);
        this.result = result;
    }

    public ReconciliationCycleResult getResult() {
        return result;
    }
}
