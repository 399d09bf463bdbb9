package com.codeops.lineage.dto.request;

import com.codeops.lineage.entity.enums.ModuleStatus;
import com.codeops.lineage.entity.enums.ModuleType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Filters and paging for module search. {@code sort} names an entity property, prefixed with
 * {@code -} for descending order; a null sort means newest first and a null size the default page size.
 */
public record ModuleSearchCriteria(
        @Size(max = 200) String title,
        ModuleType type,
        ModuleStatus status,
        UUID createdBy,
        @Size(max = 100) String branchName,
        @Min(0) int page,
        @Min(1) Integer size,
        @Size(max = 50) String sort
) {}
