package com.codeops.lineage.dto.request;

import jakarta.validation.constraints.Size;

public record ResolveMergeRequestRequest(
        @Size(max = 2000) String reason,
        boolean stopComments
) {}
