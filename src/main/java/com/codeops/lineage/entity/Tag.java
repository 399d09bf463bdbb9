package com.codeops.lineage.entity;

import com.codeops.lineage.entity.enums.TagType;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "tags",
        uniqueConstraints = @UniqueConstraint(name = "uk_tags_name_lineage", columnNames = {"name", "lineage_id"}),
        indexes = {
                @Index(name = "idx_tags_lineage_id", columnList = "lineage_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Tag extends BaseEntity {

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 2000)
    private String description;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "commit_id", nullable = false)
    private Commit commit;

    @Column(name = "lineage_id", nullable = false)
    private UUID lineageId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "tag_type", nullable = false, length = 20)
    private TagType tagType = TagType.SNAPSHOT;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;
}
