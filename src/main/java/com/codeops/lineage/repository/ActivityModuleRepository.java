package com.codeops.lineage.repository;

import com.codeops.lineage.entity.ActivityModule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ActivityModuleRepository extends JpaRepository<ActivityModule, UUID>,
        JpaSpecificationExecutor<ActivityModule> {

    Optional<ActivityModule> findBySlug(String slug);

    boolean existsBySlug(String slug);

    long countByBranchId(UUID branchId);

    @Query("select m from ActivityModule m where m.id = :lineageId or m.originModuleId = :lineageId "
            + "order by m.createdAt asc")
    List<ActivityModule> findLineage(@Param("lineageId") UUID lineageId);

    @Query("select count(m) > 0 from ActivityModule m "
            + "where (m.id = :lineageId or m.originModuleId = :lineageId) and m.branch.id = :branchId")
    boolean existsInLineageOnBranch(@Param("lineageId") UUID lineageId, @Param("branchId") UUID branchId);
}
