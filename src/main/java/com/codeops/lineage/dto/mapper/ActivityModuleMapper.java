package com.codeops.lineage.dto.mapper;

import com.codeops.lineage.dto.response.ModuleResponse;
import com.codeops.lineage.entity.ActivityModule;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/**
 * MapStruct mapper for ActivityModule entity to DTOs. The home branch is flattened into
 * its id and name.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface ActivityModuleMapper {

    @Mapping(target = "lineageId", expression = "java(entity.lineageId())")
    @Mapping(target = "branchId", source = "branch.id")
    @Mapping(target = "branchName", source = "branch.name")
    ModuleResponse toResponse(ActivityModule entity);

    List<ModuleResponse> toResponseList(List<ActivityModule> entities);
}
