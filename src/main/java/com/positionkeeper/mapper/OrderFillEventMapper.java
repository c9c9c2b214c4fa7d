package com.positionkeeper.mapper;

import com.positionkeeper.domain.model.OrderFillEvent;
import com.positionkeeper.entity.OrderFillEventEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface OrderFillEventMapper {

    OrderFillEventEntity toEntity(OrderFillEvent orderFillEvent);

    OrderFillEvent toDomain(OrderFillEventEntity entity);

    List<OrderFillEvent> toDomainList(List<OrderFillEventEntity> entities);
}
