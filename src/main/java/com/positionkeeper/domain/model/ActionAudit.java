package com.positionkeeper.domain.model;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.AuditOutcome;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionAudit {

    private Long id;
    private String positionId;
    private AuditAction action;
    private AuditOutcome outcome;
    private Map<String, Object> details;
    private String errorMessage;
    private LocalDateTime createdAt;
}
