package com.positionkeeper.mapper;

import com.positionkeeper.api.dto.request.OpenPositionRequest;
import com.positionkeeper.domain.model.PositionRequest;
import org.mapstruct.Mapper;

@Mapper
public interface PositionRequestMapper {

    PositionRequest toDomain(OpenPositionRequest openPositionRequest);
}
