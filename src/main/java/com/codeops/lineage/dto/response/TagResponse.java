package com.codeops.lineage.dto.response;

import com.codeops.lineage.entity.enums.TagType;

import java.time.Instant;
import java.util.UUID;

public record TagResponse(
        UUID id,
        String name,
        String description,
        UUID commitId,
        String commitHash,
        UUID lineageId,
        TagType tagType,
        UUID createdBy,
        Instant createdAt
) {}
