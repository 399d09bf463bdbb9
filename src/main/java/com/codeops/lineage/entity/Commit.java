package com.codeops.lineage.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable node of the commit DAG. The primary parent is stored as an id; merge commits
 * additionally own {@link CommitParent} rows for every parent.
 */
@Entity
@Table(name = "commits",
        uniqueConstraints = @UniqueConstraint(name = "uk_commits_hash", columnNames = "hash"),
        indexes = {
                @Index(name = "idx_commits_parent_commit_id", columnList = "parent_commit_id"),
                @Index(name = "idx_commits_author_id", columnList = "author_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Commit extends BaseEntity {

    @Column(nullable = false, length = 64)
    private String hash;

    @Column(nullable = false, length = 2000)
    private String message;

    @Column(name = "author_id", nullable = false)
    private UUID authorId;

    @Column(name = "committer_id", nullable = false)
    private UUID committerId;

    @Column(name = "parent_commit_id")
    private UUID parentCommitId;

    @Builder.Default
    @Column(name = "is_merge_commit", nullable = false)
    private boolean mergeCommit = false;

    @Column(name = "commit_date", nullable = false)
    private Instant commitDate;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;
}
