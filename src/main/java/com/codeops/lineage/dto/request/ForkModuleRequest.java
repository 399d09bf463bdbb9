package com.codeops.lineage.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ForkModuleRequest(
        @NotBlank @Size(max = 200) @Pattern(regexp = "^[a-z0-9][a-z0-9-]*$") String newSlug,
        @NotBlank @Size(max = 100) String branchName,
        @Size(max = 200) String title,
        @Size(max = 5000) String description
) {}
