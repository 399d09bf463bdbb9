package com.codeops.lineage.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the version-control engine, bound to the
 * {@code codeops.lineage} prefix in application properties.
 *
 * <p>{@code defaultBranch} names the branch that {@code getOrCreateDefaultBranch} creates
 * when the store has none yet. It has no effect once a default branch exists.</p>
 */
@ConfigurationProperties(prefix = "codeops.lineage")
@Getter
@Setter
public class LineageProperties {
    private String defaultBranch = AppConstants.DEFAULT_BRANCH_NAME;
    private int historyLimit = AppConstants.DEFAULT_HISTORY_LIMIT;
}
