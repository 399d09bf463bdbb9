package com.codeops.lineage.repository;

import com.codeops.lineage.entity.Commit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommitRepository extends JpaRepository<Commit, UUID> {

    Optional<Commit> findByHash(String hash);
}
