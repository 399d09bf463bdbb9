package com.codeops.lineage.entity.enums;

public enum ModuleStatus {
    DRAFT, PUBLISHED, ARCHIVED
}
