package com.codeops.lineage.repository;

import com.codeops.lineage.entity.MergeRequest;
import com.codeops.lineage.entity.enums.MergeRequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MergeRequestRepository extends JpaRepository<MergeRequest, UUID> {

    boolean existsByFromModuleIdAndToModuleIdAndStatus(UUID fromModuleId, UUID toModuleId, MergeRequestStatus status);

    @Query("select mr from MergeRequest mr "
            + "where (mr.fromModule.id = :moduleId or mr.toModule.id = :moduleId) "
            + "and (:status is null or mr.status = :status) "
            + "order by mr.createdAt desc")
    List<MergeRequest> findByModule(@Param("moduleId") UUID moduleId, @Param("status") MergeRequestStatus status);
}
