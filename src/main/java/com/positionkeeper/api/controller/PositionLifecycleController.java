package com.positionkeeper.api.controller;

import com.positionkeeper.api.dto.request.ExtendExpiryRequest;
import com.positionkeeper.api.dto.request.ManualFillRequest;
import com.positionkeeper.api.dto.request.OpenPositionRequest;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.PositionDetails;
import com.positionkeeper.domain.model.TimeTrackingView;
import com.positionkeeper.mapper.PositionRequestMapper;
import com.positionkeeper.service.PositionLifecycleEngine;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for managed positions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/positions -- open a position with its protective orders</li>
 *   <li>GET /api/positions -- list active positions</li>
 *   <li>GET /api/positions/time-tracking -- open time boxes with minutes to expiry</li>
 *   <li>GET /api/positions/{id} -- position, time box, fills and audit trail</li>
 *   <li>POST /api/positions/{id}/extend-expiry -- push the expiry back</li>
 *   <li>POST /api/positions/{id}/force-close -- cancel protective orders and complete</li>
 *   <li>POST /api/positions/{id}/manual-fill -- apply a fill made outside managed orders</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionLifecycleController {

    private static final Logger log = LoggerFactory.getLogger(PositionLifecycleController.class);

    private final PositionLifecycleEngine positionLifecycleEngine;
    private final PositionRequestMapper positionRequestMapper;

    public PositionLifecycleController(
            PositionLifecycleEngine positionLifecycleEngine, PositionRequestMapper positionRequestMapper) {
        this.positionLifecycleEngine = positionLifecycleEngine;
        this.positionRequestMapper = positionRequestMapper;
    }

    @PostMapping
    public ResponseEntity<Position> openPosition(@Valid @RequestBody OpenPositionRequest openPositionRequest) {
        log.info(
                "Open position requested: {} {} x{}",
                openPositionRequest.getDirection(),
                openPositionRequest.getSymbol(),
                openPositionRequest.getSize());
        Position position = positionLifecycleEngine.openPosition(positionRequestMapper.toDomain(openPositionRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(position);
    }

    @GetMapping
    public ResponseEntity<List<Position>> listActivePositions() {
        return ResponseEntity.ok(positionLifecycleEngine.listActivePositions());
    }

    @GetMapping("/time-tracking")
    public ResponseEntity<List<TimeTrackingView>> getTimeTrackingStatus() {
        return ResponseEntity.ok(positionLifecycleEngine.getTimeTrackingStatus());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PositionDetails> getPositionDetails(@PathVariable String id) {
        return ResponseEntity.ok(positionLifecycleEngine.getPositionDetails(id));
    }

    @PostMapping("/{id}/extend-expiry")
    public ResponseEntity<Map<String, Object>> extendExpiry(
            @PathVariable String id, @Valid @RequestBody ExtendExpiryRequest extendExpiryRequest) {
        boolean extended = positionLifecycleEngine.extendExpiry(id, extendExpiryRequest.getHours());
        return ResponseEntity.ok(Map.of("positionId", id, "extended", extended));
    }

    @PostMapping("/{id}/force-close")
    public ResponseEntity<Map<String, Object>> forceClose(@PathVariable String id) {
        boolean closed = positionLifecycleEngine.forceClose(id);
        return ResponseEntity.ok(Map.of("positionId", id, "closed", closed));
    }

    @PostMapping("/{id}/manual-fill")
    public ResponseEntity<Position> recordManualFill(
            @PathVariable String id, @Valid @RequestBody ManualFillRequest manualFillRequest) {
        return ResponseEntity.ok(positionLifecycleEngine.recordManualFill(
                id, manualFillRequest.getSize(), manualFillRequest.getPrice()));
    }
}
