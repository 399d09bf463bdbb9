package com.codeops.lineage.entity.enums;

public enum TagType {
    RELEASE, MILESTONE, SNAPSHOT
}
