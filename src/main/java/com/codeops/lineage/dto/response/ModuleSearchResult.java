package com.codeops.lineage.dto.response;

/**
 * One search hit. {@code version} is null when the module has no head on the searched branch.
 */
public record ModuleSearchResult(
        ModuleResponse module,
        VersionResponse version
) {}
