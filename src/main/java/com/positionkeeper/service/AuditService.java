package com.positionkeeper.service;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.AuditOutcome;
import com.positionkeeper.domain.model.ActionAudit;
import com.positionkeeper.entity.ActionAuditEntity;
import com.positionkeeper.mapper.ActionAuditMapper;
import com.positionkeeper.repository.jpa.ActionAuditJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Append-only audit trail of every mutation attempt on a position.
 *
 * <p>Entries are written synchronously, before the dependent side effect is applied
 * elsewhere, so that after a crash the trail still shows what the system believed and
 * what it was about to do. Rows are never updated.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final ActionAuditJpaRepository actionAuditJpaRepository;
    private final ActionAuditMapper actionAuditMapper;

    public AuditService(ActionAuditJpaRepository actionAuditJpaRepository, ActionAuditMapper actionAuditMapper) {
        this.actionAuditJpaRepository = actionAuditJpaRepository;
        this.actionAuditMapper = actionAuditMapper;
    }

    /**
     * Records a successful action.
     */
    public void success(String positionId, AuditAction action, Map<String, Object> details) {
        record(positionId, action, AuditOutcome.SUCCESS, details, null);
    }

    /**
     * Records a failed action with the error that caused it.
     */
    public void failure(String positionId, AuditAction action, Map<String, Object> details, String errorMessage) {
        record(positionId, action, AuditOutcome.FAILURE, details, errorMessage);
    }

    /**
     * Records a fully specified audit entry.
     */
    public ActionAudit record(
            String positionId,
            AuditAction action,
            AuditOutcome outcome,
            Map<String, Object> details,
            String errorMessage) {

        ActionAudit actionAudit = ActionAudit.builder()
                .positionId(positionId)
                .action(action)
                .outcome(outcome)
                .details(details)
                .errorMessage(truncate(errorMessage))
                .createdAt(LocalDateTime.now())
                .build();

        ActionAuditEntity saved = actionAuditJpaRepository.save(actionAuditMapper.toEntity(actionAudit));
        actionAudit.setId(saved.getId());

        if (outcome == AuditOutcome.FAILURE) {
            log.warn("Audit [{}] {} FAILED: {} {}", positionId, action, errorMessage, details);
        } else {
            log.debug("Audit [{}] {} {}", positionId, action, details);
        }
        return actionAudit;
    }

    /** Audit trail of one position, newest first. */
    public List<ActionAudit> getAuditTrail(String positionId) {
        return actionAuditMapper.toDomainList(actionAuditJpaRepository.findByPositionIdOrderByCreatedAtDesc(positionId));
    }

    private String truncate(String errorMessage) {
        if (errorMessage == null || errorMessage.length() <= 1000) {
            return errorMessage;
        }
        return errorMessage.substring(0, 1000);
    }
}
