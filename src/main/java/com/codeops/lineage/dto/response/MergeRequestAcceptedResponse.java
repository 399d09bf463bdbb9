package com.codeops.lineage.dto.response;

public record MergeRequestAcceptedResponse(
        MergeRequestResponse mergeRequest,
        MergeResultResponse mergeResult
) {}
