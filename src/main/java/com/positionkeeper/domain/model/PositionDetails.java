package com.positionkeeper.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Everything recorded about one position, newest audit entries first. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionDetails {

    private Position position;
    private TimeTracking timeTracking;
    private List<OrderFillEvent> fills;
    private List<ActionAudit> auditTrail;
}
