package com.codeops.lineage.repository;

import com.codeops.lineage.entity.ModuleVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ModuleVersionRepository extends JpaRepository<ModuleVersion, UUID> {

    Optional<ModuleVersion> findFirstByModuleIdAndBranchIdAndCurrentHeadTrue(UUID moduleId, UUID branchId);

    List<ModuleVersion> findByBranchIdAndCurrentHeadTrueOrderByCreatedAtAsc(UUID branchId);

    List<ModuleVersion> findByModuleIdAndBranchIdAndCurrentHeadTrue(UUID moduleId, UUID branchId);

    Optional<ModuleVersion> findFirstByModuleIdAndBranchIdAndCommitIdOrderByCreatedAtDesc(
            UUID moduleId, UUID branchId, UUID commitId);

    Optional<ModuleVersion> findFirstByCommitIdOrderByCreatedAtAsc(UUID commitId);

    List<ModuleVersion> findByModuleIdAndBranchIdOrderByCreatedAtAsc(UUID moduleId, UUID branchId);

    long countByModuleIdAndBranchId(UUID moduleId, UUID branchId);

    long countByModuleIdAndBranchIdAndCurrentHeadTrue(UUID moduleId, UUID branchId);

    void deleteByModuleId(UUID moduleId);

    void deleteByBranchId(UUID branchId);
}
