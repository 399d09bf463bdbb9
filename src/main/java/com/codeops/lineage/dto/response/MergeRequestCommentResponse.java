package com.codeops.lineage.dto.response;

import java.time.Instant;
import java.util.UUID;

public record MergeRequestCommentResponse(
        UUID id,
        UUID mergeRequestId,
        String body,
        UUID createdBy,
        Instant createdAt
) {}
