package com.codeops.lineage.entity.enums;

/**
 * Lifecycle of a merge request. {@code OPEN} is the only non-terminal state.
 */
public enum MergeRequestStatus {
    OPEN, MERGED, REJECTED, CLOSED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
