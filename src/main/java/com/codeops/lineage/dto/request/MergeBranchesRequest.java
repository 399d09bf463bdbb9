package com.codeops.lineage.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MergeBranchesRequest(
        @NotBlank @Size(max = 100) String sourceBranch,
        @NotBlank @Size(max = 100) String targetBranch,
        @Size(max = 2000) String mergeMessage
) {}
