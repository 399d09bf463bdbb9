package com.codeops.lineage.dto.request;

import com.codeops.lineage.entity.enums.ModuleStatus;
import com.codeops.lineage.entity.enums.ModuleType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record CreateModuleRequest(
        @NotBlank @Size(max = 200) @Pattern(regexp = "^[a-z0-9][a-z0-9-]*$") String slug,
        @NotBlank @Size(max = 200) String title,
        @Size(max = 5000) String description,
        @NotNull ModuleType type,
        ModuleStatus status,
        @NotNull Map<String, Object> content,
        @Size(max = 2000) String commitMessage
) {}
