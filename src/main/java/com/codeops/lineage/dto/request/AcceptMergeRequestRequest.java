package com.codeops.lineage.dto.request;

import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Acceptance of a merge request. {@code resolvedContent} is the reconciled document used for
 * every module whose histories diverged; it is ignored for copies and fast-forwards.
 */
public record AcceptMergeRequestRequest(
        @Size(max = 2000) String reason,
        Map<String, Object> resolvedContent
) {}
