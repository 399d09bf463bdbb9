package com.codeops.lineage.dto.response;

import java.util.List;

public record MergeResultResponse(
        String sourceBranch,
        String targetBranch,
        int mergedVersionCount,
        int newCommitCount,
        List<ModuleMergeOutcome> outcomes
) {}
