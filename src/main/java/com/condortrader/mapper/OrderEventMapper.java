package com.condortrader.mapper;

import com.condortrader.entity.OrderEventEntity;
import com.condortrader.execution.OrderEventRecord;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between OrderEventRecord and OrderEventEntity. Field names match
 * one to one; the log sequence is the entity's identity column.
 */
@Mapper
public interface OrderEventMapper {

    @Mapping(target = "id", ignore = true)
    OrderEventEntity toEntity(OrderEventRecord record);

    @Mapping(source = "id", target = "sequence")
    OrderEventRecord toDomain(OrderEventEntity entity);

    List<OrderEventRecord> toDomainList(List<OrderEventEntity> entities);
}
