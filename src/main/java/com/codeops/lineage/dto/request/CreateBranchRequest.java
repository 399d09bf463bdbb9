package com.codeops.lineage.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateBranchRequest(
        @NotBlank @Size(max = 100) String branchName,
        @Size(max = 100) String fromBranch,
        @Size(max = 2000) String description
) {}
