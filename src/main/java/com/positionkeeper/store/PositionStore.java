package com.positionkeeper.store;

import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.enums.TrackingStatus;
import com.positionkeeper.domain.model.ExchangeScope;
import com.positionkeeper.domain.model.OrderFillEvent;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.TimeTracking;
import com.positionkeeper.entity.OrderFillEventEntity;
import com.positionkeeper.entity.PositionEntity;
import com.positionkeeper.entity.TimeTrackingEntity;
import com.positionkeeper.exception.BusinessException;
import com.positionkeeper.exception.ErrorCode;
import com.positionkeeper.exception.ResourceNotFoundException;
import com.positionkeeper.mapper.OrderFillEventMapper;
import com.positionkeeper.mapper.PositionMapper;
import com.positionkeeper.mapper.TimeTrackingMapper;
import com.positionkeeper.repository.jpa.OrderFillEventJpaRepository;
import com.positionkeeper.repository.jpa.PositionJpaRepository;
import com.positionkeeper.repository.jpa.TimeTrackingJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable store for positions, their fill events and their time tracking rows.
 *
 * <p>This is the only writer of position state. Every multi-field change runs in one
 * transaction and is validated against the position invariants before it is written:
 * <ul>
 *   <li>phases never move backwards and nothing leaves a terminal phase</li>
 *   <li>{@code remainingSize} is never negative</li>
 *   <li>{@code remainingSize == 0} exactly when the phase is terminal</li>
 * </ul>
 *
 * <p>No remote calls happen here; callers talk to the exchange first and record the
 * confirmed outcome afterwards.
 */
@Service
public class PositionStore {

    private static final Logger log = LoggerFactory.getLogger(PositionStore.class);

    static final Set<PositionPhase> TERMINAL_PHASES = EnumSet.of(PositionPhase.COMPLETED, PositionPhase.STOPPED_OUT);
    static final Set<TrackingStatus> OPEN_TRACKING = EnumSet.of(TrackingStatus.ACTIVE, TrackingStatus.WARNED);
    static final Set<TrackingStatus> CLOSED_TRACKING =
            EnumSet.of(TrackingStatus.EXPIRED, TrackingStatus.FORCE_CLOSED);

    private final PositionJpaRepository positionJpaRepository;
    private final OrderFillEventJpaRepository orderFillEventJpaRepository;
    private final TimeTrackingJpaRepository timeTrackingJpaRepository;
    private final PositionMapper positionMapper;
    private final OrderFillEventMapper orderFillEventMapper;
    private final TimeTrackingMapper timeTrackingMapper;

    public PositionStore(
            PositionJpaRepository positionJpaRepository,
            OrderFillEventJpaRepository orderFillEventJpaRepository,
            TimeTrackingJpaRepository timeTrackingJpaRepository,
            PositionMapper positionMapper,
            OrderFillEventMapper orderFillEventMapper,
            TimeTrackingMapper timeTrackingMapper) {
        this.positionJpaRepository = positionJpaRepository;
        this.orderFillEventJpaRepository = orderFillEventJpaRepository;
        this.timeTrackingJpaRepository = timeTrackingJpaRepository;
        this.positionMapper = positionMapper;
        this.orderFillEventMapper = orderFillEventMapper;
        this.timeTrackingMapper = timeTrackingMapper;
    }

    // ---- Positions ----

    /**
     * Persists a new position together with its time tracking row.
     */
    @Transactional
    public Position create(Position position, TimeTracking timeTracking) {
        if (position.getPhase() == null || position.getPhase().isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_STATE, "New position must start in a non-terminal phase");
        }
        if (position.getRemainingSize() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_STATE, "New position must have a positive remaining size");
        }
        if (position.getStopOrderId() == null) {
            throw new BusinessException(ErrorCode.INVALID_STATE, "New position must carry a stop order");
        }

        PositionEntity saved = positionJpaRepository.save(positionMapper.toEntity(position));
        timeTrackingJpaRepository.save(timeTrackingMapper.toEntity(timeTracking));

        log.info(
                "Position stored: id={}, symbol={}, direction={}, size={}, expiresAt={}",
                saved.getId(),
                saved.getSymbol(),
                saved.getDirection(),
                saved.getRemainingSize(),
                timeTracking.getExpiresAt());
        return positionMapper.toDomain(saved);
    }

    public Optional<Position> get(String id) {
        return positionJpaRepository.findById(id).map(positionMapper::toDomain);
    }

    public Position getOrThrow(String id) {
        return get(id).orElseThrow(() -> ResourceNotFoundException.position(id));
    }

    /** Non-terminal positions, oldest first. */
    public List<Position> listActive() {
        return positionMapper.toDomainList(positionJpaRepository.findActive(TERMINAL_PHASES));
    }

    public long countActive() {
        return positionJpaRepository.countActive(TERMINAL_PHASES);
    }

    public boolean hasActivePosition(String symbol, ExchangeScope scope) {
        return positionJpaRepository.existsActive(
                symbol, scope.getCredentialId(), scope.getMarket(), TERMINAL_PHASES);
    }

    /**
     * Moves a position to {@code phase}, optionally setting the remaining size.
     * A terminal phase always forces the remaining size to zero.
     */
    @Transactional
    public Position applyPhaseTransition(String id, PositionPhase phase, Integer remainingSize) {
        return applyPhaseTransition(id, phase, remainingSize, null, null);
    }

    /**
     * Moves a position to {@code phase} in one transaction: remaining size, realized PnL
     * accrual and close reason are written together or not at all.
     *
     * @param remainingSize    new remaining size, or null to keep the current one
     * @param realizedPnlDelta PnL to add to the accumulator, or null
     * @param closeReason      recorded when the phase is terminal
     * @throws BusinessException with INVALID_STATE when the transition breaks an invariant
     */
    @Transactional
    public Position applyPhaseTransition(
            String id,
            PositionPhase phase,
            Integer remainingSize,
            BigDecimal realizedPnlDelta,
            String closeReason) {
        PositionEntity entity =
                positionJpaRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.position(id));

        PositionPhase current = entity.getPhase();
        if (current.isTerminal()) {
            throw invalidTransition(id, current, phase, "position is already closed");
        }
        if (phase != current && !current.canTransitionTo(phase)) {
            throw invalidTransition(id, current, phase, "phases only move forward");
        }

        int newRemaining = remainingSize != null ? remainingSize : entity.getRemainingSize();
        if (phase.isTerminal()) {
            newRemaining = 0;
        }
        if (newRemaining < 0) {
            throw invalidTransition(id, current, phase, "remaining size would be negative: " + newRemaining);
        }
        if (newRemaining == 0 && !phase.isTerminal()) {
            throw invalidTransition(id, current, phase, "remaining size 0 requires a terminal phase");
        }

        entity.setPhase(phase);
        entity.setRemainingSize(newRemaining);
        if (realizedPnlDelta != null) {
            BigDecimal accrued = entity.getRealizedPnl() != null ? entity.getRealizedPnl() : BigDecimal.ZERO;
            entity.setRealizedPnl(accrued.add(realizedPnlDelta));
        }
        if (phase.isTerminal()) {
            entity.setCloseReason(closeReason);
        }
        entity.setUpdatedAt(LocalDateTime.now());

        PositionEntity saved = positionJpaRepository.save(entity);
        log.info("Position {} phase {} -> {}, remaining={}", id, current, phase, newRemaining);
        return positionMapper.toDomain(saved);
    }

    /**
     * Swaps the stored stop order id and price. Returns false when the position is
     * unknown or already terminal, in which case nothing is written.
     */
    @Transactional
    public boolean replaceStopOrder(String id, String orderId, BigDecimal price) {
        int updated = positionJpaRepository.updateStopOrder(id, orderId, price, LocalDateTime.now(), TERMINAL_PHASES);
        if (updated == 0) {
            log.warn("Stop order not replaced for position {}: not found or already closed", id);
            return false;
        }
        log.info("Position {} stop replaced: orderId={}, price={}", id, orderId, price);
        return true;
    }

    // ---- Fill events ----

    /**
     * Appends a fill event unless one already exists for the same order id.
     *
     * @return true if inserted, false if the order id was already recorded
     */
    public boolean recordFill(OrderFillEvent fillEvent) {
        if (orderFillEventJpaRepository.existsByOrderId(fillEvent.getOrderId())) {
            return false;
        }
        try {
            OrderFillEventEntity saved = orderFillEventJpaRepository.save(orderFillEventMapper.toEntity(fillEvent));
            fillEvent.setId(saved.getId());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Fill for order {} recorded concurrently, skipping duplicate", fillEvent.getOrderId());
            return false;
        }
    }

    public boolean markFillProcessed(String orderId) {
        return orderFillEventJpaRepository.markProcessed(orderId, LocalDateTime.now()) > 0;
    }

    public Optional<OrderFillEvent> findFill(String orderId) {
        return orderFillEventJpaRepository.findByOrderId(orderId).map(orderFillEventMapper::toDomain);
    }

    public List<OrderFillEvent> findFills(String positionId) {
        return orderFillEventMapper.toDomainList(orderFillEventJpaRepository.findByPositionIdOrderByFilledAtAsc(positionId));
    }

    public List<OrderFillEvent> findUnprocessedFills() {
        return orderFillEventMapper.toDomainList(orderFillEventJpaRepository.findByProcessedFalseOrderByFilledAtAsc());
    }

    // ---- Time tracking ----

    public Optional<TimeTracking> getTracking(String positionId) {
        return timeTrackingJpaRepository.findById(positionId).map(timeTrackingMapper::toDomain);
    }

    /** ACTIVE and WARNED rows, soonest expiry first. */
    public List<TimeTracking> listOpenTracking() {
        return timeTrackingMapper.toDomainList(timeTrackingJpaRepository.findByStatusInOrderByExpiresAtAsc(OPEN_TRACKING));
    }

    /** Sets the warning flag. Returns false if it was already set. */
    public boolean markWarningSent(String positionId, LocalDateTime now) {
        return timeTrackingJpaRepository.markWarningSent(positionId, TrackingStatus.WARNED, now) > 0;
    }

    /** Sets the force-close attempt flag. Returns false if it was already set. */
    public boolean markForceCloseAttempted(String positionId, LocalDateTime now) {
        return timeTrackingJpaRepository.markForceCloseAttempted(positionId, now) > 0;
    }

    public void updateTrackingStatus(String positionId, TrackingStatus status, LocalDateTime now) {
        timeTrackingJpaRepository.updateStatus(positionId, status, now);
    }

    /**
     * Pushes the expiry of an open tracking row back by {@code hours} and starts a fresh
     * time box: warning and attempt flags cleared, status ACTIVE.
     *
     * @return false when there is no open tracking row for the position
     */
    @Transactional
    public boolean extendExpiry(String positionId, int hours, LocalDateTime now) {
        Optional<TimeTrackingEntity> found = timeTrackingJpaRepository.findById(positionId);
        if (found.isEmpty() || !found.get().getStatus().isOpen()) {
            return false;
        }
        TimeTrackingEntity entity = found.get();
        entity.setExpiresAt(entity.getExpiresAt().plusHours(hours));
        entity.setWarningSent(false);
        entity.setForceCloseAttempted(false);
        entity.setStatus(TrackingStatus.ACTIVE);
        entity.setUpdatedAt(now);
        timeTrackingJpaRepository.save(entity);
        log.info("Position {} expiry extended by {}h to {}", positionId, hours, entity.getExpiresAt());
        return true;
    }

    /** Deletes EXPIRED and FORCE_CLOSED rows whose expiry is older than {@code cutoff}. */
    public int purgeClosedTracking(LocalDateTime cutoff) {
        return timeTrackingJpaRepository.deleteClosedBefore(CLOSED_TRACKING, cutoff);
    }

    private BusinessException invalidTransition(String id, PositionPhase from, PositionPhase to, String reason) {
        return new BusinessException(
                ErrorCode.INVALID_STATE,
                String.format("Invalid transition %s -> %s for position %s: %s", from, to, id, reason),
                Map.of("positionId", id, "from", from.name(), "to", to.name()));
    }
}
