package com.codeops.lineage.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for AppConstants and the defaults of LineageProperties.
 */
class AppConstantsTest {

    @Test
    void constants_areAccessibleAndNonNull() {
        assertThat(AppConstants.DEFAULT_PAGE_SIZE).isEqualTo(10);
        assertThat(AppConstants.MAX_PAGE_SIZE).isEqualTo(100);
        assertThat(AppConstants.DEFAULT_BRANCH_NAME).isEqualTo("main");
        assertThat(AppConstants.DEFAULT_HISTORY_LIMIT).isEqualTo(50);
        assertThat(AppConstants.COPY_COMMIT_PREFIX).isEqualTo("Copy from ");
    }

    @Test
    void mergeCommitFormat_fillsSourceAndTarget() {
        assertThat(String.format(AppConstants.MERGE_COMMIT_FORMAT, "feature", "main"))
                .isEqualTo("Merge feature into main");
    }

    @Test
    void lineageProperties_defaultToConstants() {
        LineageProperties properties = new LineageProperties();

        assertThat(properties.getDefaultBranch()).isEqualTo(AppConstants.DEFAULT_BRANCH_NAME);
        assertThat(properties.getHistoryLimit()).isEqualTo(AppConstants.DEFAULT_HISTORY_LIMIT);
    }
}
