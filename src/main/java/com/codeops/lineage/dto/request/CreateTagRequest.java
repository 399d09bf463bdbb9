package com.codeops.lineage.dto.request;

import com.codeops.lineage.entity.enums.TagType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTagRequest(
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Size(max = 64) String commitHash,
        @Size(max = 2000) String description,
        TagType tagType
) {}
