package com.codeops.lineage.dto.response;

public record ModuleSnapshotResponse(
        ModuleResponse module,
        VersionResponse version,
        BranchResponse branch
) {}
