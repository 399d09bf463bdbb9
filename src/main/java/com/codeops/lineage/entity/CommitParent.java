package com.codeops.lineage.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "commit_parents",
        uniqueConstraints = @UniqueConstraint(name = "uk_commit_parents_order",
                columnNames = {"commit_id", "parent_order"}),
        indexes = {
                @Index(name = "idx_commit_parents_commit_id", columnList = "commit_id"),
                @Index(name = "idx_commit_parents_parent_commit_id", columnList = "parent_commit_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommitParent extends BaseEntity {

    @Column(name = "commit_id", nullable = false)
    private UUID commitId;

    @Column(name = "parent_commit_id", nullable = false)
    private UUID parentCommitId;

    @Column(name = "parent_order", nullable = false)
    private int parentOrder;
}
