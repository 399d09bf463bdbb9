package com.codeops.lineage.dto.mapper;

import com.codeops.lineage.dto.response.TagResponse;
import com.codeops.lineage.entity.Tag;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface TagMapper {

    @Mapping(target = "commitId", source = "commit.id")
    @Mapping(target = "commitHash", source = "commit.hash")
    TagResponse toResponse(Tag entity);

    List<TagResponse> toResponseList(List<Tag> entities);
}
