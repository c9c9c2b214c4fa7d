package com.positionkeeper.repository.jpa;

import com.positionkeeper.domain.enums.PositionPhase;
import com.positionkeeper.entity.PositionEntity;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the position_states table.
 * Phase/size transitions go through PositionStore (read-validate-write in one transaction);
 * the stop swap is a single guarded UPDATE.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    @Query("SELECT p FROM PositionEntity p WHERE p.phase NOT IN :terminal ORDER BY p.createdAt ASC")
    List<PositionEntity> findActive(@Param("terminal") Collection<PositionPhase> terminal);

    @Query("SELECT COUNT(p) FROM PositionEntity p WHERE p.phase NOT IN :terminal")
    long countActive(@Param("terminal") Collection<PositionPhase> terminal);

    @Query("SELECT COUNT(p) > 0 FROM PositionEntity p WHERE p.symbol = :symbol AND p.credentialId = :credentialId"
            + " AND p.market = :market AND p.phase NOT IN :terminal")
    boolean existsActive(
            @Param("symbol") String symbol,
            @Param("credentialId") String credentialId,
            @Param("market") String market,
            @Param("terminal") Collection<PositionPhase> terminal);

    @Modifying
    @Transactional
    @Query("UPDATE PositionEntity p SET p.stopOrderId = :orderId, p.currentStopPrice = :price, p.updatedAt = :now"
            + " WHERE p.id = :id AND p.phase NOT IN :terminal")
    int updateStopOrder(
            @Param("id") String id,
            @Param("orderId") String orderId,
            @Param("price") BigDecimal price,
            @Param("now") LocalDateTime now,
            @Param("terminal") Collection<PositionPhase> terminal);
}
