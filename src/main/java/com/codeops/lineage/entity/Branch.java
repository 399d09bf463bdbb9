package com.codeops.lineage.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "branches",
        uniqueConstraints = @UniqueConstraint(name = "uk_branches_name", columnNames = "name"),
        indexes = {
                @Index(name = "idx_branches_is_default", columnList = "is_default")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Branch extends BaseEntity {

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 2000)
    private String description;

    @Builder.Default
    @Column(name = "is_default", nullable = false)
    private boolean defaultBranch = false;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;
}
