package com.codeops.lineage.repository;

import com.codeops.lineage.entity.ActivityModule;
import com.codeops.lineage.entity.enums.ModuleStatus;
import com.codeops.lineage.entity.enums.ModuleType;
import org.springframework.data.jpa.domain.Specification;

import java.util.UUID;

/**
 * Search predicates for {@link ActivityModule}. A {@code null} argument yields a
 * {@code null} specification, which Spring Data treats as "no restriction".
 */
public final class ActivityModuleSpecifications {

    private ActivityModuleSpecifications() {}

    public static Specification<ActivityModule> titleContains(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        String pattern = "%" + title.toLowerCase() + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.get("title")), pattern);
    }

    public static Specification<ActivityModule> hasType(ModuleType type) {
        return type == null ? null : (root, query, cb) -> cb.equal(root.get("type"), type);
    }

    public static Specification<ActivityModule> hasStatus(ModuleStatus status) {
        return status == null ? null : (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<ActivityModule> createdBy(UUID userId) {
        return userId == null ? null : (root, query, cb) -> cb.equal(root.get("createdBy"), userId);
    }
}
