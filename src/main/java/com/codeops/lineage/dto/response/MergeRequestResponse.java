package com.codeops.lineage.dto.response;

import com.codeops.lineage.entity.enums.MergeRequestStatus;

import java.time.Instant;
import java.util.UUID;

public record MergeRequestResponse(
        UUID id,
        String title,
        String description,
        MergeRequestStatus status,
        UUID fromModuleId,
        String fromModuleSlug,
        UUID toModuleId,
        String toModuleSlug,
        UUID createdBy,
        UUID mergedBy,
        Instant mergedAt,
        UUID rejectedBy,
        Instant rejectedAt,
        UUID closedBy,
        Instant closedAt,
        String resolutionReason,
        boolean allowComments,
        Instant createdAt,
        Instant updatedAt
) {}
