package com.positionkeeper.mapper;

import com.positionkeeper.domain.model.Position;
import com.positionkeeper.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between Position domain model and PositionEntity. All fields match 1:1.
 */
@Mapper
public interface PositionMapper {

    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
