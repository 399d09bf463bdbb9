package com.codeops.lineage.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Materialized snapshot of a module's content on a branch at a commit.
 *
 * <p>At most one version per (module, branch) has {@code currentHead} set. The
 * {@code lockVersion} column turns two concurrent head demotions into an optimistic
 * locking failure.</p>
 */
@Entity
@Table(name = "module_versions",
        indexes = {
                @Index(name = "idx_module_versions_module_branch", columnList = "module_id, branch_id"),
                @Index(name = "idx_module_versions_branch_head", columnList = "branch_id, is_current_head"),
                @Index(name = "idx_module_versions_commit_id", columnList = "commit_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModuleVersion extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "module_id", nullable = false)
    private ActivityModule module;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "branch_id", nullable = false)
    private Branch branch;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "commit_id", nullable = false)
    private Commit commit;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 5000)
    private String description;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Builder.Default
    @Column(name = "is_current_head", nullable = false)
    private boolean currentHead = false;

    @Version
    @Column(name = "lock_version")
    private Long lockVersion;
}
