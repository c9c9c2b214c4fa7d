package com.positionkeeper.entity;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.AuditOutcome;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the action_audit table.
 * Immutable trail of every mutation attempt, successful or not. Rows are never updated.
 */
@Entity
@Table(name = "action_audit")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActionAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "position_id", length = 36)
    private String positionId;

    @Enumerated(EnumType.STRING)
    @Column(length = 40, nullable = false)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private AuditOutcome outcome;

    /** Structured detail (order ids, prices, counts) as JSON text. */
    @Lob
    @Column(name = "details_json")
    private String detailsJson;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
