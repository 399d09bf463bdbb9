package com.codeops.lineage.dto.response;

import com.codeops.lineage.entity.enums.MergeAction;

import java.util.UUID;

/**
 * What a merge did to one target module. {@code headCommitHash} is the target's head commit
 * after the merge, or null when the module was skipped and had no head.
 */
public record ModuleMergeOutcome(
        UUID moduleId,
        String moduleSlug,
        MergeAction action,
        int versionsCreated,
        int commitsCreated,
        String headCommitHash
) {}
