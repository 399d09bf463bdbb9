package com.codeops.lineage.repository;

import com.codeops.lineage.entity.MergeRequestComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MergeRequestCommentRepository extends JpaRepository<MergeRequestComment, UUID> {

    List<MergeRequestComment> findByMergeRequestIdOrderByCreatedAtAsc(UUID mergeRequestId);

    void deleteByMergeRequestId(UUID mergeRequestId);
}
