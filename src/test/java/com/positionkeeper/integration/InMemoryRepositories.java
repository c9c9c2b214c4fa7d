package com.positionkeeper.integration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.domain.enums.TrackingStatus;
import com.positionkeeper.entity.ActionAuditEntity;
import com.positionkeeper.entity.OrderFillEventEntity;
import com.positionkeeper.entity.PositionEntity;
import com.positionkeeper.entity.TimeTrackingEntity;
import com.positionkeeper.repository.jpa.ActionAuditJpaRepository;
import com.positionkeeper.repository.jpa.OrderFillEventJpaRepository;
import com.positionkeeper.repository.jpa.PositionJpaRepository;
import com.positionkeeper.repository.jpa.TimeTrackingJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Map-backed stand-ins for the JPA repositories, so integration tests run the real
 * PositionStore and AuditService without a database or Spring context.
 */
class InMemoryRepositories {

    final Map<String, PositionEntity> positions = new ConcurrentHashMap<>();
    final Map<Long, OrderFillEventEntity> fills = new ConcurrentHashMap<>();
    final Map<String, TimeTrackingEntity> tracking = new ConcurrentHashMap<>();
    final List<ActionAuditEntity> audits = new ArrayList<>();

    private final AtomicLong idSequence = new AtomicLong();

    final PositionJpaRepository positionJpaRepository = mock(PositionJpaRepository.class);
    final OrderFillEventJpaRepository orderFillEventJpaRepository = mock(OrderFillEventJpaRepository.class);
    final TimeTrackingJpaRepository timeTrackingJpaRepository = mock(TimeTrackingJpaRepository.class);
    final ActionAuditJpaRepository actionAuditJpaRepository = mock(ActionAuditJpaRepository.class);

    InMemoryRepositories() {
        wirePositions();
        wireFills();
        wireTracking();
        wireAudits();
    }

    @SuppressWarnings("unchecked")
    private void wirePositions() {
        when(positionJpaRepository.save(any(PositionEntity.class))).thenAnswer(inv -> {
            PositionEntity entity = inv.getArgument(0);
            positions.put(entity.getId(), entity);
            return entity;
        });
        when(positionJpaRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(positions.get((String) inv.getArgument(0))));
        when(positionJpaRepository.findActive(any())).thenAnswer(inv -> positions.values().stream()
                .filter(p -> !((Collection<PositionPhase>) inv.getArgument(0)).contains(p.getPhase()))
                .sorted(Comparator.comparing(PositionEntity::getCreatedAt))
                .toList());
        when(positionJpaRepository.countActive(any())).thenAnswer(inv -> positions.values().stream()
                .filter(p -> !((Collection<PositionPhase>) inv.getArgument(0)).contains(p.getPhase()))
                .count());
        when(positionJpaRepository.existsActive(anyString(), anyString(), anyString(), any()))
                .thenAnswer(inv -> positions.values().stream()
                        .anyMatch(p -> p.getSymbol().equals(inv.getArgument(0))
                                && p.getCredentialId().equals(inv.getArgument(1))
                                && p.getMarket().equals(inv.getArgument(2))
                                && !((Collection<PositionPhase>) inv.getArgument(3)).contains(p.getPhase())));
        when(positionJpaRepository.updateStopOrder(anyString(), anyString(), any(), any(), any()))
                .thenAnswer(inv -> {
                    PositionEntity entity = positions.get((String) inv.getArgument(0));
                    Collection<PositionPhase> terminal = inv.getArgument(4);
                    if (entity == null || terminal.contains(entity.getPhase())) {
                        return 0;
                    }
                    entity.setStopOrderId(inv.getArgument(1));
                    entity.setCurrentStopPrice((BigDecimal) inv.getArgument(2));
                    entity.setUpdatedAt(inv.getArgument(3));
                    return 1;
                });
    }

    private void wireFills() {
        when(orderFillEventJpaRepository.save(any(OrderFillEventEntity.class))).thenAnswer(inv -> {
            OrderFillEventEntity entity = inv.getArgument(0);
            boolean duplicate = fills.values().stream().anyMatch(f -> f.getOrderId().equals(entity.getOrderId()));
            if (duplicate && entity.getId() == null) {
                throw new DataIntegrityViolationException("unique order_id " + entity.getOrderId());
            }
            if (entity.getId() == null) {
                entity.setId(idSequence.incrementAndGet());
            }
            fills.put(entity.getId(), entity);
            return entity;
        });
        when(orderFillEventJpaRepository.existsByOrderId(anyString()))
                .thenAnswer(inv -> findFill(inv.getArgument(0)).isPresent());
        when(orderFillEventJpaRepository.findByOrderId(anyString())).thenAnswer(inv -> findFill(inv.getArgument(0)));
        when(orderFillEventJpaRepository.findByPositionIdOrderByFilledAtAsc(anyString()))
                .thenAnswer(inv -> fills.values().stream()
                        .filter(f -> f.getPositionId().equals(inv.getArgument(0)))
                        .sorted(Comparator.comparing(OrderFillEventEntity::getFilledAt))
                        .toList());
        when(orderFillEventJpaRepository.findByProcessedFalseOrderByFilledAtAsc())
                .thenAnswer(inv -> fills.values().stream()
                        .filter(f -> !f.isProcessed())
                        .sorted(Comparator.comparing(OrderFillEventEntity::getFilledAt))
                        .toList());
        when(orderFillEventJpaRepository.markProcessed(anyString(), any())).thenAnswer(inv -> {
            Optional<OrderFillEventEntity> fill = findFill(inv.getArgument(0));
            if (fill.isEmpty() || fill.get().isProcessed()) {
                return 0;
            }
            fill.get().setProcessed(true);
            fill.get().setProcessedAt(inv.getArgument(1));
            return 1;
        });
    }

    @SuppressWarnings("unchecked")
    private void wireTracking() {
        when(timeTrackingJpaRepository.save(any(TimeTrackingEntity.class))).thenAnswer(inv -> {
            TimeTrackingEntity entity = inv.getArgument(0);
            tracking.put(entity.getPositionId(), entity);
            return entity;
        });
        when(timeTrackingJpaRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(tracking.get((String) inv.getArgument(0))));
        when(timeTrackingJpaRepository.findByStatusInOrderByExpiresAtAsc(any()))
                .thenAnswer(inv -> tracking.values().stream()
                        .filter(t -> ((Collection<TrackingStatus>) inv.getArgument(0)).contains(t.getStatus()))
                        .sorted(Comparator.comparing(TimeTrackingEntity::getExpiresAt))
                        .toList());
        when(timeTrackingJpaRepository.markWarningSent(anyString(), any(), any())).thenAnswer(inv -> {
            TimeTrackingEntity entity = tracking.get((String) inv.getArgument(0));
            if (entity == null || entity.isWarningSent()) {
                return 0;
            }
            entity.setWarningSent(true);
            entity.setStatus(inv.getArgument(1));
            entity.setUpdatedAt(inv.getArgument(2));
            return 1;
        });
        when(timeTrackingJpaRepository.markForceCloseAttempted(anyString(), any()))
                .thenAnswer(inv -> {
                    TimeTrackingEntity entity = tracking.get((String) inv.getArgument(0));
                    if (entity == null || entity.isForceCloseAttempted()) {
                        return 0;
                    }
                    entity.setForceCloseAttempted(true);
                    entity.setUpdatedAt(inv.getArgument(1));
                    return 1;
                });
        when(timeTrackingJpaRepository.updateStatus(anyString(), any(), any())).thenAnswer(inv -> {
            TimeTrackingEntity entity = tracking.get((String) inv.getArgument(0));
            if (entity == null) {
                return 0;
            }
            entity.setStatus(inv.getArgument(1));
            entity.setUpdatedAt(inv.getArgument(2));
            return 1;
        });
        when(timeTrackingJpaRepository.deleteClosedBefore(any(), any())).thenAnswer(inv -> {
            Collection<TrackingStatus> statuses = inv.getArgument(0);
            LocalDateTime cutoff = inv.getArgument(1);
            List<String> doomed = tracking.values().stream()
                    .filter(t -> statuses.contains(t.getStatus()) && t.getExpiresAt().isBefore(cutoff))
                    .map(TimeTrackingEntity::getPositionId)
                    .toList();
            doomed.forEach(tracking::remove);
            return doomed.size();
        });
    }

    private void wireAudits() {
        when(actionAuditJpaRepository.save(any(ActionAuditEntity.class))).thenAnswer(inv -> {
            ActionAuditEntity entity = inv.getArgument(0);
            entity.setId(idSequence.incrementAndGet());
            synchronized (audits) {
                audits.add(entity);
            }
            return entity;
        });
        when(actionAuditJpaRepository.findByPositionIdOrderByCreatedAtDesc(anyString()))
                .thenAnswer(inv -> {
                    synchronized (audits) {
                        List<ActionAuditEntity> trail = new ArrayList<>(audits.stream()
                                .filter(a -> inv.getArgument(0).equals(a.getPositionId()))
                                .toList());
                        java.util.Collections.reverse(trail);
                        return trail;
                    }
                });
    }

    private Optional<OrderFillEventEntity> findFill(String orderId) {
        return fills.values().stream().filter(f -> f.getOrderId().equals(orderId)).findFirst();
    }
}
