package com.codeops.lineage.repository;

import com.codeops.lineage.entity.Tag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TagRepository extends JpaRepository<Tag, UUID> {

    boolean existsByNameAndLineageId(String name, UUID lineageId);

    Optional<Tag> findByNameAndLineageId(String name, UUID lineageId);

    List<Tag> findByLineageIdOrderByCreatedAtDesc(UUID lineageId);
}
