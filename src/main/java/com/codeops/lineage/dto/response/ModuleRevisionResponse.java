package com.codeops.lineage.dto.response;

public record ModuleRevisionResponse(
        ModuleResponse module,
        VersionResponse version,
        CommitResponse commit,
        BranchResponse branch
) {}
