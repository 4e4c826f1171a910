package com.condortrader.mapper;

import com.condortrader.domain.model.OptionLeg;
import com.condortrader.domain.model.Position;
import com.condortrader.entity.PositionArchiveEntity;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between a closed Position and PositionArchiveEntity.
 *
 * <p>Leg lists are stored as JSON strings via {@link JsonHelper}. Working state of an open
 * position (outstanding orders, applied fill keys, pending roll) is not archived.
 */
@Mapper
public interface PositionArchiveMapper {

    @Mapping(source = "legs", target = "legs", qualifiedByName = "legsToJson")
    @Mapping(source = "retiredLegs", target = "retiredLegs", qualifiedByName = "legsToJson")
    @Mapping(target = "archivedAt", ignore = true)
    PositionArchiveEntity toEntity(Position position);

    @Mapping(source = "legs", target = "legs", qualifiedByName = "jsonToLegs")
    @Mapping(source = "retiredLegs", target = "retiredLegs", qualifiedByName = "jsonToLegs")
    @Mapping(target = "unrealizedPnl", ignore = true)
    @Mapping(target = "pendingRoll", ignore = true)
    @Mapping(target = "permanentRejection", ignore = true)
    @Mapping(target = "outstandingOrders", ignore = true)
    @Mapping(target = "appliedFills", ignore = true)
    @Mapping(target = "orderSequence", ignore = true)
    Position toDomain(PositionArchiveEntity entity);

    List<Position> toDomainList(List<PositionArchiveEntity> entities);

    @Named("legsToJson")
    default String legsToJson(List<OptionLeg> legs) {
        return JsonHelper.toJson(legs);
    }

    @Named("jsonToLegs")
    default List<OptionLeg> jsonToLegs(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, OptionLeg.class));
    }
}
