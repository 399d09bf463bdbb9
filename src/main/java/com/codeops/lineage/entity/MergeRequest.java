package com.codeops.lineage.entity;

import com.codeops.lineage.entity.enums.MergeRequestStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "merge_requests",
        indexes = {
                @Index(name = "idx_merge_requests_from_module_id", columnList = "from_module_id"),
                @Index(name = "idx_merge_requests_to_module_id", columnList = "to_module_id"),
                @Index(name = "idx_merge_requests_status", columnList = "status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MergeRequest extends BaseEntity {

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 5000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MergeRequestStatus status;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "from_module_id", nullable = false)
    private ActivityModule fromModule;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "to_module_id", nullable = false)
    private ActivityModule toModule;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(name = "merged_by")
    private UUID mergedBy;

    @Column(name = "merged_at")
    private Instant mergedAt;

    @Column(name = "rejected_by")
    private UUID rejectedBy;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "closed_by")
    private UUID closedBy;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "resolution_reason", length = 2000)
    private String resolutionReason;

    @Builder.Default
    @Column(name = "allow_comments", nullable = false)
    private boolean allowComments = true;

    @Version
    @Column(name = "lock_version")
    private Long lockVersion;
}
