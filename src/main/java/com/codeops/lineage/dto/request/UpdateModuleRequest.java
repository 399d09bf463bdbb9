package com.codeops.lineage.dto.request;

import com.codeops.lineage.entity.enums.ModuleStatus;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Partial update of a module on a branch. {@code content} is overlaid on the prior head's
 * content one top-level key at a time; a null branch name targets the module's home branch.
 */
public record UpdateModuleRequest(
        @Size(max = 100) String branchName,
        Map<String, Object> content,
        @Size(max = 200) String title,
        @Size(max = 5000) String description,
        ModuleStatus status,
        @Size(max = 2000) String commitMessage
) {}
