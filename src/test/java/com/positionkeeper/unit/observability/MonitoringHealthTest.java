package com.positionkeeper.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.model.MonitoringError;
import com.positionkeeper.observability.MonitoringHealth;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MonitoringHealthTest {

    private MonitoringHealth monitoringHealth;

    @BeforeEach
    void setUp() {
        monitoringHealth = new MonitoringHealth();
    }

    @Test
    void recordCycle_tracksLastAndLastSuccessful() {
        LocalDateTime first = LocalDateTime.of(2025, 3, 1, 10, 0);
        LocalDateTime second = first.plusSeconds(30);

        monitoringHealth.recordCycle(first, true);
        monitoringHealth.recordCycle(second, false);

        assertThat(monitoringHealth.getCycleCount()).isEqualTo(2);
        assertThat(monitoringHealth.getLastCycleTime()).isEqualTo(second);
        assertThat(monitoringHealth.getLastSuccessfulCycleTime()).isEqualTo(first);
    }

    @Test
    void recordError_newestFirstAndCappedAtOneHundred() {
        for (int i = 0; i < 105; i++) {
            monitoringHealth.recordError(ErrorSeverity.WARNING, "P" + i, "error " + i);
        }

        List<MonitoringError> errors = monitoringHealth.getRecentErrors();
        assertThat(errors).hasSize(100);
        assertThat(errors.get(0).getMessage()).isEqualTo("error 104");
        assertThat(errors.get(99).getMessage()).isEqualTo("error 5");
        assertThat(monitoringHealth.getLastError().getSource()).isEqualTo("P104");
    }

    @Test
    void getRecentErrors_returnsCopy() {
        monitoringHealth.recordError(ErrorSeverity.CRITICAL, "P1", "unprotected");

        monitoringHealth.getRecentErrors().clear();

        assertThat(monitoringHealth.getRecentErrors()).hasSize(1);
        assertThat(monitoringHealth.getLastError().getSeverity()).isEqualTo(ErrorSeverity.CRITICAL);
    }
}
