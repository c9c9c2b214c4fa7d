package com.positionkeeper.api.controller;

import com.positionkeeper.api.dto.request.OrphanCleanupRequest;
import com.positionkeeper.domain.model.EngineStatus;
import com.positionkeeper.domain.model.ReconciliationCycleResult;
import com.positionkeeper.reconciliation.OrphanCleanupResult;
import com.positionkeeper.service.PositionLifecycleEngine;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Engine-wide operations: health, manual reconciliation, monitoring control and orphan cleanup.
 */
@RestController
@RequestMapping("/api/engine")
public class EngineController {

    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private final PositionLifecycleEngine positionLifecycleEngine;

    public EngineController(PositionLifecycleEngine positionLifecycleEngine) {
        this.positionLifecycleEngine = positionLifecycleEngine;
    }

    @GetMapping("/status")
    public ResponseEntity<EngineStatus> getStatus() {
        return ResponseEntity.ok(positionLifecycleEngine.getStatus());
    }

    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationCycleResult> reconcile() {
        return ResponseEntity.ok(positionLifecycleEngine.runReconciliationNow());
    }

    @PostMapping("/emergency-stop")
    public ResponseEntity<EngineStatus> emergencyStop() {
        log.warn("Emergency stop requested via API");
        positionLifecycleEngine.emergencyStop();
        return ResponseEntity.ok(positionLifecycleEngine.getStatus());
    }

    @PostMapping("/resume")
    public ResponseEntity<EngineStatus> resume() {
        log.info("Monitoring resume requested via API");
        positionLifecycleEngine.resumeMonitoring();
        return ResponseEntity.ok(positionLifecycleEngine.getStatus());
    }

    @PostMapping("/orphaned-orders/cleanup")
    public ResponseEntity<OrphanCleanupResult> cleanupOrphanedOrders(
            @Valid @RequestBody OrphanCleanupRequest orphanCleanupRequest) {
        return ResponseEntity.ok(positionLifecycleEngine.cleanupOrphanedOrders(
                orphanCleanupRequest.getCredentialId(), orphanCleanupRequest.getMarket()));
    }
}
