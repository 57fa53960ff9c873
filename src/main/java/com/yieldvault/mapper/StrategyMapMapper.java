package com.yieldvault.mapper;

import com.yieldvault.domain.model.StrategyMapEntry;
import com.yieldvault.domain.model.StrategyRecord;
import com.yieldvault.integration.StrategyEntryPoint;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from the allocator's StrategyRecord to the read-only StrategyMapEntry.
 *
 * <p>{@code totalAssetsAvailable} comes from a live call on the entry point and is filled in by
 * the allocator, not here.
 */
@Mapper
public interface StrategyMapMapper {

    @Mapping(source = "name", target = "strategyName")
    @Mapping(source = "entryPoint", target = "entryPoint", qualifiedByName = "entryPointAddress")
    @Mapping(target = "totalAssetsAvailable", ignore = true)
    StrategyMapEntry toEntry(StrategyRecord strategyRecord);

    @Named("entryPointAddress")
    default String entryPointAddress(StrategyEntryPoint entryPoint) {
        return entryPoint != null ? entryPoint.address() : null;
    }
}
