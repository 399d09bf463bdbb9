package com.codeops.lineage.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "merge_request_comments",
        indexes = {
                @Index(name = "idx_merge_request_comments_merge_request_id", columnList = "merge_request_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MergeRequestComment extends BaseEntity {

    @Column(nullable = false, length = 5000)
    private String body;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "merge_request_id", nullable = false)
    private MergeRequest mergeRequest;
}
