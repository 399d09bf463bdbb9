package com.codeops.lineage.dto.response;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record VersionResponse(
        UUID id,
        UUID moduleId,
        UUID branchId,
        String branchName,
        UUID commitId,
        String commitHash,
        String title,
        String description,
        Map<String, Object> content,
        String contentHash,
        boolean currentHead,
        Instant createdAt
) {}
