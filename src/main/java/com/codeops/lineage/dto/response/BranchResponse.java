package com.codeops.lineage.dto.response;

import java.time.Instant;
import java.util.UUID;

public record BranchResponse(
        UUID id,
        String name,
        String description,
        boolean isDefault,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt
) {}
