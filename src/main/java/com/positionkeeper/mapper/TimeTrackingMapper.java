package com.positionkeeper.mapper;

import com.positionkeeper.domain.model.TimeTracking;
import com.positionkeeper.entity.TimeTrackingEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface TimeTrackingMapper {

    TimeTrackingEntity toEntity(TimeTracking timeTracking);

    TimeTracking toDomain(TimeTrackingEntity entity);

    List<TimeTracking> toDomainList(List<TimeTrackingEntity> entities);
}
