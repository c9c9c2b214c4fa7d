package com.positionkeeper.repository.jpa;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.entity.ActionAuditEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the action_audit table. Insert and read only.
 */
@Repository
public interface ActionAuditJpaRepository extends JpaRepository<ActionAuditEntity, Long> {

    List<ActionAuditEntity> findByPositionIdOrderByCreatedAtDesc(String positionId);

    List<ActionAuditEntity> findByAction(AuditAction action);

    @Query("SELECT a FROM ActionAuditEntity a WHERE a.createdAt BETWEEN :from AND :to ORDER BY a.createdAt DESC")
    List<ActionAuditEntity> findByDateRange(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
