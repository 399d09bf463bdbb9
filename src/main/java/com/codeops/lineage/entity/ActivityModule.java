package com.codeops.lineage.entity;

import com.codeops.lineage.entity.enums.ModuleStatus;
import com.codeops.lineage.entity.enums.ModuleType;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * An authoring unit whose content history is tracked by commits and versions.
 *
 * <p>A root module has no {@code originModuleId}; its lineage is itself. A fork records the
 * root's id in {@code originModuleId} and the module it was forked from in
 * {@code forkedFromModuleId}, so two modules share a lineage exactly when their
 * {@link #lineageId()} values are equal.</p>
 */
@Entity
@Table(name = "activity_modules",
        uniqueConstraints = @UniqueConstraint(name = "uk_activity_modules_slug", columnNames = "slug"),
        indexes = {
                @Index(name = "idx_activity_modules_origin_module_id", columnList = "origin_module_id"),
                @Index(name = "idx_activity_modules_branch_id", columnList = "branch_id"),
                @Index(name = "idx_activity_modules_created_by", columnList = "created_by")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActivityModule extends BaseEntity {

    @Column(nullable = false, length = 200)
    private String slug;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 5000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "module_type", nullable = false, length = 20)
    private ModuleType type;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ModuleStatus status = ModuleStatus.DRAFT;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(name = "origin_module_id")
    private UUID originModuleId;

    @Column(name = "forked_from_module_id")
    private UUID forkedFromModuleId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "branch_id", nullable = false)
    private Branch branch;

    /**
     * Returns the id of the root module of this module's lineage.
     */
    public UUID lineageId() {
        return originModuleId != null ? originModuleId : getId();
    }
}
