package com.codeops.lineage.config;

import com.codeops.lineage.dto.request.CreateMergeRequestRequest;
import com.codeops.lineage.dto.request.CreateModuleRequest;
import com.codeops.lineage.dto.request.CreateTagRequest;
import com.codeops.lineage.dto.request.ForkModuleRequest;
import com.codeops.lineage.dto.request.UpdateModuleRequest;
import com.codeops.lineage.dto.response.ForkModuleResponse;
import com.codeops.lineage.dto.response.ModuleRevisionResponse;
import com.codeops.lineage.entity.enums.ModuleStatus;
import com.codeops.lineage.entity.enums.ModuleType;
import com.codeops.lineage.entity.enums.TagType;
import com.codeops.lineage.repository.ActivityModuleRepository;
import com.codeops.lineage.service.MergeRequestService;
import com.codeops.lineage.service.ModuleService;
import com.codeops.lineage.service.TagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Seeds a demo lineage for development: a page module with two commits on the default
 * branch, a fork on a {@code draft} branch with its own commit, a release tag and an open
 * merge request from the fork back to the page.
 * Only runs in the {@code dev} profile and is idempotent.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    static final UUID SEED_USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
    static final String SEED_SLUG = "welcome-page";
    static final String SEED_FORK_SLUG = "welcome-page-draft";

    private final ActivityModuleRepository moduleRepository;
    private final ModuleService moduleService;
    private final MergeRequestService mergeRequestService;
    private final TagService tagService;

    /**
     * Seeds development data on application startup, skipping if the demo module exists.
     *
     * @param args command-line arguments (unused)
     */
    @Override
    @Transactional
    public void run(String... args) {
        if (moduleRepository.existsBySlug(SEED_SLUG)) {
            log.info("DataSeeder: Demo lineage already exists, skipping.");
            return;
        }

        ModuleRevisionResponse created = moduleService.createModule(SEED_USER_ID, new CreateModuleRequest(
                SEED_SLUG, "Welcome", "Course landing page", ModuleType.PAGE, ModuleStatus.PUBLISHED,
                Map.of("body", "Welcome to the course.", "blocks", List.of("intro")), null));

        ModuleRevisionResponse updated = moduleService.updateModule(SEED_SLUG, SEED_USER_ID, new UpdateModuleRequest(
                null, Map.of("blocks", List.of("intro", "syllabus")), null, null, null, "Add syllabus block"));

        tagService.createTag(created.module().id(), SEED_USER_ID, new CreateTagRequest(
                "v1", updated.commit().hash(), "First published layout", TagType.RELEASE));

        ForkModuleResponse fork = moduleService.forkModule(SEED_SLUG, SEED_USER_ID, new ForkModuleRequest(
                SEED_FORK_SLUG, "draft", "Welcome (draft)", null));

        moduleService.updateModule(SEED_FORK_SLUG, SEED_USER_ID, new UpdateModuleRequest(
                null, Map.of("body", "Welcome to the autumn course."), null, null, null, "Reword greeting"));

        mergeRequestService.createMergeRequest(SEED_USER_ID, new CreateMergeRequestRequest(
                "Autumn greeting", "Carry the reworded greeting back to the page",
                fork.module().id(), created.module().id()));

        log.info("DataSeeder: Seeded lineage '{}' with fork '{}' and 1 merge request", SEED_SLUG, SEED_FORK_SLUG);
    }
}
