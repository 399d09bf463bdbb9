package com.codeops.lineage.dto.response;

import com.codeops.lineage.entity.enums.ModuleStatus;
import com.codeops.lineage.entity.enums.ModuleType;

import java.time.Instant;
import java.util.UUID;

public record ModuleResponse(
        UUID id,
        String slug,
        String title,
        String description,
        ModuleType type,
        ModuleStatus status,
        UUID createdBy,
        UUID originModuleId,
        UUID forkedFromModuleId,
        UUID lineageId,
        UUID branchId,
        String branchName,
        Instant createdAt,
        Instant updatedAt
) {}
