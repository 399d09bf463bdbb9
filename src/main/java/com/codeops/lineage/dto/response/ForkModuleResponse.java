package com.codeops.lineage.dto.response;

public record ForkModuleResponse(
        ModuleResponse module,
        ModuleResponse sourceModule,
        VersionResponse version,
        BranchResponse branch
) {}
