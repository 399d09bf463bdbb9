package com.codeops.lineage.service;

import com.codeops.lineage.dto.response.VersionResponse;
import com.codeops.lineage.entity.ActivityModule;
import com.codeops.lineage.entity.Branch;
import com.codeops.lineage.entity.Commit;
import com.codeops.lineage.entity.ModuleVersion;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.repository.ModuleVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service maintaining the materialized versions of modules and their head pointers.
 *
 * <p>For every (module, branch) pair at most one version is the current head. Every write goes
 * through {@link #appendHead}, which demotes the previous head in the same transaction as the
 * insert of its successor.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class VersionService {

    private final ModuleVersionRepository versionRepository;
    private final ContentCodec contentCodec;

    @Transactional(readOnly = true)
    public Optional<ModuleVersion> findHead(ActivityModule module, Branch branch) {
        return versionRepository.findFirstByModuleIdAndBranchIdAndCurrentHeadTrue(module.getId(), branch.getId());
    }

    /**
     * Loads the current head of a module on a branch.
     *
     * @throws NotFoundException if the module has no head on the branch
     */
    @Transactional(readOnly = true)
    public ModuleVersion requireHead(ActivityModule module, Branch branch) {
        return findHead(module, branch)
                .orElseThrow(() -> new NotFoundException(
                        "Module '" + module.getSlug() + "' has no version on branch '" + branch.getName() + "'"));
    }

    /**
     * Inserts a new head version for (module, branch), demoting whatever head was there.
     *
     * @param module      the module
     * @param branch      the branch
     * @param commit      the commit the version points at
     * @param content     the content snapshot
     * @param contentHash hash of {@code content}
     * @param title       title mirror
     * @param description description mirror
     * @return the saved head version
     */
    public ModuleVersion appendHead(ActivityModule module, Branch branch, Commit commit, Map<String, Object> content,
                                    String contentHash, String title, String description) {
        return appendHead(module, branch, commit, contentCodec.encode(content), contentHash, title, description);
    }

    /**
     * Variant of {@link #appendHead(ActivityModule, Branch, Commit, Map, String, String, String)} taking
     * content that is already in its stored form.
     */
    public ModuleVersion appendHead(ActivityModule module, Branch branch, Commit commit, String encodedContent,
                                    String contentHash, String title, String description) {
        demoteHeads(module, branch);
        ModuleVersion version = ModuleVersion.builder()
                .module(module)
                .branch(branch)
                .commit(commit)
                .content(encodedContent)
                .contentHash(contentHash)
                .title(title)
                .description(description)
                .currentHead(true)
                .build();
        return versionRepository.save(version);
    }

    /**
     * Copies a version onto another branch, pointing at the same commit.
     *
     * @param source the version to copy
     * @param target the branch receiving the copy
     * @return the new head version on {@code target}
     */
    public ModuleVersion copyToBranch(ModuleVersion source, Branch target) {
        return appendHead(source.getModule(), target, source.getCommit(), source.getContent(),
                source.getContentHash(), source.getTitle(), source.getDescription());
    }

    /**
     * Builds the response for a version, decoding its content.
     */
    @Transactional(readOnly = true)
    public VersionResponse toResponse(ModuleVersion version) {
        return new VersionResponse(
                version.getId(),
                version.getModule().getId(),
                version.getBranch().getId(),
                version.getBranch().getName(),
                version.getCommit().getId(),
                version.getCommit().getHash(),
                version.getTitle(),
                version.getDescription(),
                contentCodec.decode(version.getContent()),
                version.getContentHash(),
                version.isCurrentHead(),
                version.getCreatedAt()
        );
    }

    public Map<String, Object> content(ModuleVersion version) {
        return contentCodec.decode(version.getContent());
    }

    private void demoteHeads(ActivityModule module, Branch branch) {
        if (module.getId() == null) {
            return;
        }
        List<ModuleVersion> heads = versionRepository.findByModuleIdAndBranchIdAndCurrentHeadTrue(
                module.getId(), branch.getId());
        for (ModuleVersion head : heads) {
            head.setCurrentHead(false);
            versionRepository.save(head);
        }
        if (heads.size() > 1) {
            log.warn("Demoted {} heads of module '{}' on branch '{}'", heads.size(), module.getSlug(), branch.getName());
        }
    }
}
