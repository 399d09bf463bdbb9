package com.codeops.lineage.dto.response;

public record CreateBranchResponse(
        BranchResponse branch,
        BranchResponse sourceBranch,
        int copiedVersionCount
) {}
