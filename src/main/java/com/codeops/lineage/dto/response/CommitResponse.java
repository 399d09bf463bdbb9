package com.codeops.lineage.dto.response;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A commit as seen by callers. A linear commit has at most one entry in {@code parentIds},
 * equal to {@code parentCommitId}; a merge commit lists every parent, primary parent first.
 */
public record CommitResponse(
        UUID id,
        String hash,
        String message,
        UUID authorId,
        UUID committerId,
        UUID parentCommitId,
        boolean mergeCommit,
        List<UUID> parentIds,
        String contentHash,
        Instant commitDate
) {}
