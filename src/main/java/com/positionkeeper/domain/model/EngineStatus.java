package com.positionkeeper.domain.model;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineStatus {

    private int activeCount;
    private boolean monitoringEnabled;
    private long cycleCount;
    private LocalDateTime lastCycleTime;
    private LocalDateTime lastSuccessfulCycleTime;
    private String lastError;
    private LocalDateTime lastErrorTime;
    private List<MonitoringError> recentErrors;
}
