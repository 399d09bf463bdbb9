package com.codeops.lineage.entity.enums;

/**
 * How the merge engine treats one module when folding a source head into a target.
 */
public enum MergeAction {
    /** No head on the target; the source content is copied under a new commit. */
    COPY,
    /** Both heads carry the same content hash. */
    UNCHANGED,
    /** The target head is an ancestor of the source head; the source commits are adopted. */
    FAST_FORWARD,
    /** The source head is an ancestor of the target head. */
    TARGET_AHEAD,
    /** Divergent heads folded together under a merge commit. */
    THREE_WAY,
    /** Divergent heads where the source commit is older than the target commit. */
    STALE_SOURCE;

    /**
     * Whether this action leaves the target untouched.
     */
    public boolean isSkip() {
        return this == UNCHANGED || this == TARGET_AHEAD || this == STALE_SOURCE;
    }

    /**
     * Whether the two heads diverged and a reconciled document is needed to merge them.
     */
    public boolean isDivergent() {
        return this == THREE_WAY || this == STALE_SOURCE;
    }
}
