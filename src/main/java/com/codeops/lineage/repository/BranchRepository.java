package com.codeops.lineage.repository;

import com.codeops.lineage.entity.Branch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BranchRepository extends JpaRepository<Branch, UUID> {

    Optional<Branch> findByName(String name);

    boolean existsByName(String name);

    Optional<Branch> findFirstByDefaultBranchTrueOrderByCreatedAtAsc();

    List<Branch> findAllByOrderByCreatedAtAsc();
}
