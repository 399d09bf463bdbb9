package com.codeops.lineage.exception;

import java.util.List;

/**
 * Thrown when accepting a merge request would need a three-way merge and no resolved
 * content was supplied. Lists the slugs of the modules whose histories diverged.
 */
public class ConflictResolutionRequiredException extends LineageException {

    private final List<String> conflictingModules;

    /**
     * Creates a new ConflictResolutionRequiredException.
     *
     * @param message            the detail message
     * @param conflictingModules slugs of the modules needing resolution
     */
    public ConflictResolutionRequiredException(String message, List<String> conflictingModules) {
        super(message, ErrorKind.CONFLICT_RESOLUTION_REQUIRED);
        this.conflictingModules = List.copyOf(conflictingModules);
    }

    public List<String> getConflictingModules() {
        return conflictingModules;
    }
}
