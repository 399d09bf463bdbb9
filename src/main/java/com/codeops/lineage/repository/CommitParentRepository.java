package com.codeops.lineage.repository;

import com.codeops.lineage.entity.CommitParent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CommitParentRepository extends JpaRepository<CommitParent, UUID> {

    List<CommitParent> findByCommitIdOrderByParentOrderAsc(UUID commitId);
}
