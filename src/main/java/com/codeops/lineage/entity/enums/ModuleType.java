package com.codeops.lineage.entity.enums;

public enum ModuleType {
    PAGE, WHITEBOARD, ASSIGNMENT, QUIZ, DISCUSSION
}
