package com.positionkeeper.repository.jpa;

import com.positionkeeper.entity.OrderFillEventEntity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface OrderFillEventJpaRepository extends JpaRepository<OrderFillEventEntity, Long> {

    boolean existsByOrderId(String orderId);

    Optional<OrderFillEventEntity> findByOrderId(String orderId);

    List<OrderFillEventEntity> findByPositionIdOrderByFilledAtAsc(String positionId);

    List<OrderFillEventEntity> findByProcessedFalseOrderByFilledAtAsc();

    @Modifying
    @Transactional
    @Query("UPDATE OrderFillEventEntity f SET f.processed = true, f.processedAt = :now"
            + " WHERE f.orderId = :orderId AND f.processed = false")
    int markProcessed(@Param("orderId") String orderId, @Param("now") LocalDateTime now);
}
