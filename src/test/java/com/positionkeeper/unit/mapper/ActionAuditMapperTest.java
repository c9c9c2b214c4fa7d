package com.positionkeeper.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionkeeper.domain.enums.AuditAction;
import com.positionkeeper.domain.enums.AuditOutcome;
import com.positionkeeper.domain.model.ActionAudit;
import com.positionkeeper.entity.ActionAuditEntity;
import com.positionkeeper.mapper.ActionAuditMapper;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

/**
 * Unit tests for the ActionAuditMapper (MapStruct), including the JSON encoding of the details map.
 */
class ActionAuditMapperTest {

    private final ActionAuditMapper actionAuditMapper = Mappers.getMapper(ActionAuditMapper.class);

    @Test
    @DisplayName("toEntity serializes details to JSON")
    void toEntitySerializesDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("oldOrderId", "SL-1");
        details.put("newPrice", new BigDecimal("50025"));

        ActionAudit audit = ActionAudit.builder()
                .positionId("P1")
                .action(AuditAction.SL_UPDATED_BREAK_EVEN)
                .outcome(AuditOutcome.SUCCESS)
                .details(details)
                .createdAt(LocalDateTime.of(2025, 3, 1, 10, 0))
                .build();

        ActionAuditEntity entity = actionAuditMapper.toEntity(audit);

        assertThat(entity.getPositionId()).isEqualTo("P1");
        assertThat(entity.getAction()).isEqualTo(AuditAction.SL_UPDATED_BREAK_EVEN);
        assertThat(entity.getOutcome()).isEqualTo(AuditOutcome.SUCCESS);
        assertThat(entity.getDetailsJson()).isEqualTo("{\"oldOrderId\":\"SL-1\",\"newPrice\":50025}");
        assertThat(entity.getCreatedAt()).isEqualTo(audit.getCreatedAt());
    }

    @Test
    @DisplayName("Empty details are stored as null")
    void emptyDetailsStoredAsNull() {
        ActionAudit audit = ActionAudit.builder()
                .action(AuditAction.ORPHAN_ORDER_CANCELLED)
                .outcome(AuditOutcome.FAILURE)
                .details(Map.of())
                .errorMessage("unknown order")
                .build();

        ActionAuditEntity entity = actionAuditMapper.toEntity(audit);

        assertThat(entity.getDetailsJson()).isNull();
        assertThat(entity.getErrorMessage()).isEqualTo("unknown order");
    }

    @Test
    @DisplayName("toDomain parses JSON details, null JSON gives an empty map")
    void toDomainParsesDetails() {
        ActionAuditEntity withDetails = ActionAuditEntity.builder()
                .id(7L)
                .positionId("P1")
                .action(AuditAction.FORCE_CLOSE_EXECUTED)
                .outcome(AuditOutcome.SUCCESS)
                .detailsJson("{\"reason\":\"time box expiring\",\"remainingSize\":2}")
                .build();
        ActionAuditEntity withoutDetails = ActionAuditEntity.builder()
                .id(8L)
                .action(AuditAction.EXPIRY_WARNING)
                .outcome(AuditOutcome.SUCCESS)
                .build();

        ActionAudit audit = actionAuditMapper.toDomain(withDetails);

        assertThat(audit.getId()).isEqualTo(7L);
        assertThat(audit.getDetails())
                .containsEntry("reason", "time box expiring")
                .containsEntry("remainingSize", 2);
        assertThat(actionAuditMapper.toDomain(withoutDetails).getDetails()).isEmpty();
    }
}
