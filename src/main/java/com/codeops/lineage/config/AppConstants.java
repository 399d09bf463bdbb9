package com.codeops.lineage.config;

/**
 * Application-wide constants for the CodeOps-Lineage service.
 * Centralizes pagination bounds, branch defaults, and default commit messages.
 */
public final class AppConstants {

    private AppConstants() {}

    /** Default number of items per page for paginated responses. */
    public static final int DEFAULT_PAGE_SIZE = 10;

    /** Maximum allowed page size to prevent excessive data retrieval. */
    public static final int MAX_PAGE_SIZE = 100;

    /** Name given to the default branch when it is created on demand. */
    public static final String DEFAULT_BRANCH_NAME = "main";

    /** Default number of commits returned by a history walk. */
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    /** Upper bound for a single history walk. */
    public static final int MAX_HISTORY_LIMIT = 500;

    /** Commit message used for the first commit of a module. */
    public static final String INITIAL_COMMIT_MESSAGE = "Initial commit";

    /** Commit message used when an update supplies none. */
    public static final String UPDATE_COMMIT_MESSAGE = "Update activity module";

    /** Prefix of the commit message written when a merge copies a module onto a branch. */
    public static final String COPY_COMMIT_PREFIX = "Copy from ";

    /** Format of the default merge commit message, filled with source and target names. */
    public static final String MERGE_COMMIT_FORMAT = "Merge %s into %s";
}
