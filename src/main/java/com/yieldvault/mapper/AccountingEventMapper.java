package com.yieldvault.mapper;

import com.yieldvault.domain.model.AccountingEventRecord;
import com.yieldvault.entity.AccountingEventEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between AccountingEventRecord and AccountingEventEntity. The details map is
 * a JSON string in the entity.
 */
@Mapper
public interface AccountingEventMapper {

    @Mapping(source = "details", target = "details", qualifiedByName = "mapToJson")
    AccountingEventEntity toEntity(AccountingEventRecord eventRecord);

    @Mapping(source = "details", target = "details", qualifiedByName = "jsonToMap")
    AccountingEventRecord toDomain(AccountingEventEntity entity);

    List<AccountingEventRecord> toDomainList(List<AccountingEventEntity> entities);

    List<AccountingEventEntity> toEntityList(List<AccountingEventRecord> records);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> details) {
        return JsonHelper.toJson(details);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.toMap(json);
    }
}
