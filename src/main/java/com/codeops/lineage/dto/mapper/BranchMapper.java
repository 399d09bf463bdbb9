package com.codeops.lineage.dto.mapper;

import com.codeops.lineage.dto.response.BranchResponse;
import com.codeops.lineage.entity.Branch;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/**
 * MapStruct mapper for Branch entity to DTOs.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface BranchMapper {

    /**
     * Maps a Branch entity to a response DTO.
     *
     * @param entity the Branch entity
     * @return the response DTO
     */
    @Mapping(target = "isDefault", source = "defaultBranch")
    BranchResponse toResponse(Branch entity);

    List<BranchResponse> toResponseList(List<Branch> entities);
}
