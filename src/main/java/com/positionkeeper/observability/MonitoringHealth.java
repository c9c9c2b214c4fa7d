package com.positionkeeper.observability;

import com.positionkeeper.domain.enums.ErrorSeverity;
import com.positionkeeper.domain.model.MonitoringError;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Health of the polling loop: cycle timestamps, last error, and a ring buffer of the
 * most recent {@value #MAX_ERRORS} errors (newest first).
 */
@Component
public class MonitoringHealth {

    private static final Logger log = LoggerFactory.getLogger(MonitoringHealth.class);

    static final int MAX_ERRORS = 100;

    private final ConcurrentLinkedDeque<MonitoringError> recentErrors = new ConcurrentLinkedDeque<>();
    private final AtomicLong cycleCount = new AtomicLong();

    private volatile LocalDateTime lastCycleTime;
    private volatile LocalDateTime lastSuccessfulCycleTime;
    private volatile MonitoringError lastError;

    public void recordCycle(LocalDateTime completedAt, boolean successful) {
        cycleCount.incrementAndGet();
        lastCycleTime = completedAt;
        if (successful) {
            lastSuccessfulCycleTime = completedAt;
        }
    }

    public void recordError(ErrorSeverity severity, String source, String message) {
        MonitoringError error = MonitoringError.builder()
                .timestamp(LocalDateTime.now())
                .severity(severity)
                .source(source)
                .message(message)
                .build();
        recentErrors.addFirst(error);
        while (recentErrors.size() > MAX_ERRORS) {
            recentErrors.pollLast();
        }
        lastError = error;
        if (severity == ErrorSeverity.CRITICAL) {
            log.error("CRITICAL [{}]: {}", source, message);
        }
    }

    public List<MonitoringError> getRecentErrors() {
        return new ArrayList<>(recentErrors);
    }

    public long getCycleCount() {
        return cycleCount.get();
    }

    public LocalDateTime getLastCycleTime() {
        return lastCycleTime;
    }

    public LocalDateTime getLastSuccessfulCycleTime() {
        return lastSuccessfulCycleTime;
    }

    public MonitoringError getLastError() {
        return lastError;
    }
}
