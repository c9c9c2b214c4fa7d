package com.positionkeeper.mapper;

import com.positionkeeper.domain.model.ActionAudit;
import com.positionkeeper.entity.ActionAuditEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between ActionAudit and ActionAuditEntity.
 * The details map is stored as a JSON string in the details_json column.
 */
@Mapper
public interface ActionAuditMapper {

    @Mapping(source = "details", target = "detailsJson", qualifiedByName = "detailsToJson")
    ActionAuditEntity toEntity(ActionAudit actionAudit);

    @Mapping(source = "detailsJson", target = "details", qualifiedByName = "jsonToDetails")
    ActionAudit toDomain(ActionAuditEntity entity);

    List<ActionAudit> toDomainList(List<ActionAuditEntity> entities);

    @Named("detailsToJson")
    default String detailsToJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        return JsonHelper.toJson(details);
    }

    @Named("jsonToDetails")
    default Map<String, Object> jsonToDetails(String json) {
        return JsonHelper.toMap(json);
    }
}
