package com.codeops.lineage.dto.mapper;

import com.codeops.lineage.dto.response.MergeRequestCommentResponse;
import com.codeops.lineage.entity.MergeRequestComment;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/**
 * MapStruct mapper for merge request comments.
 */
@Mapper(componentModel = "spring", builder = @Builder(disableBuilder = true))
public interface MergeRequestCommentMapper {

    /**
     * Maps a comment entity to a response DTO.
     *
     * @param entity the comment entity
     * @return the response DTO
     */
    @Mapping(target = "mergeRequestId", source = "mergeRequest.id")
    MergeRequestCommentResponse toResponse(MergeRequestComment entity);

    List<MergeRequestCommentResponse> toResponseList(List<MergeRequestComment> entities);
}
