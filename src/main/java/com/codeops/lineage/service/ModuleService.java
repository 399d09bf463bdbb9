package com.codeops.lineage.service;

import com.codeops.lineage.config.AppConstants;
import com.codeops.lineage.dto.mapper.ActivityModuleMapper;
import com.codeops.lineage.dto.mapper.BranchMapper;
import com.codeops.lineage.dto.request.CreateModuleRequest;
import com.codeops.lineage.dto.request.ForkModuleRequest;
import com.codeops.lineage.dto.request.ModuleSearchCriteria;
import com.codeops.lineage.dto.request.UpdateModuleRequest;
import com.codeops.lineage.dto.response.ForkModuleResponse;
import com.codeops.lineage.dto.response.ModuleResponse;
import com.codeops.lineage.dto.response.ModuleRevisionResponse;
import com.codeops.lineage.dto.response.ModuleSearchResult;
import com.codeops.lineage.dto.response.ModuleSnapshotResponse;
import com.codeops.lineage.dto.response.PageResponse;
import com.codeops.lineage.dto.response.VersionResponse;
import com.codeops.lineage.entity.ActivityModule;
import com.codeops.lineage.entity.Branch;
import com.codeops.lineage.entity.Commit;
import com.codeops.lineage.entity.MergeRequest;
import com.codeops.lineage.entity.ModuleVersion;
import com.codeops.lineage.entity.enums.ModuleStatus;
import com.codeops.lineage.exception.DuplicateSlugException;
import com.codeops.lineage.exception.InvalidOperationException;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.exception.ValidationException;
import com.codeops.lineage.repository.ActivityModuleRepository;
import com.codeops.lineage.repository.ActivityModuleSpecifications;
import com.codeops.lineage.repository.MergeRequestCommentRepository;
import com.codeops.lineage.repository.MergeRequestRepository;
import com.codeops.lineage.repository.ModuleVersionRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Service for writing and reading module content. Every write produces a commit and a new
 * head version on one branch inside a single transaction; a failure at any step leaves the
 * previous head untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
@Validated
public class ModuleService {

    private static final Set<String> SORTABLE_PROPERTIES = Set.of("createdAt", "updatedAt", "title", "slug", "status", "type");

    private final ActivityModuleRepository moduleRepository;
    private final ModuleVersionRepository versionRepository;
    private final MergeRequestRepository mergeRequestRepository;
    private final MergeRequestCommentRepository commentRepository;
    private final BranchService branchService;
    private final CommitService commitService;
    private final VersionService versionService;
    private final ContentHasher contentHasher;
    private final ContentCodec contentCodec;
    private final ActivityModuleMapper moduleMapper;
    private final BranchMapper branchMapper;

    /**
     * Creates a module with its initial commit and head version on the default branch.
     *
     * @param actorId the author
     * @param request the module definition and initial content
     * @return the module, version, commit and branch
     * @throws DuplicateSlugException if the slug is taken
     */
    public ModuleRevisionResponse createModule(@NotNull UUID actorId, @Valid CreateModuleRequest request) {
        if (moduleRepository.existsBySlug(request.slug())) {
            throw new DuplicateSlugException("Module slug already exists: " + request.slug());
        }

        Branch branch = branchService.resolveDefaultBranch(actorId);

        ActivityModule module = moduleRepository.save(ActivityModule.builder()
                .slug(request.slug())
                .title(request.title())
                .description(request.description())
                .type(request.type())
                .status(request.status() != null ? request.status() : ModuleStatus.DRAFT)
                .createdBy(actorId)
                .branch(branch)
                .build());

        Map<String, Object> content = request.content();
        String contentHash = contentHasher.contentHash(content);
        String message = request.commitMessage() != null ? request.commitMessage() : AppConstants.INITIAL_COMMIT_MESSAGE;
        Commit commit = commitService.createCommit(content, contentHash, message, actorId, null);
        ModuleVersion version = versionService.appendHead(module, branch, commit, content, contentHash,
                module.getTitle(), module.getDescription());

        log.info("Created module '{}' on branch '{}' at commit {}", module.getSlug(), branch.getName(), commit.getHash());
        return toRevisionResponse(module, version, commit, branch);
    }

    /**
     * Commits a change to a module on a branch. Incoming content is overlaid on the prior
     * head's content; omitted keys keep their prior values.
     *
     * @param slug    the module slug
     * @param actorId the author
     * @param request the partial update, targeting the module's home branch when no branch is named
     * @return the module, new head version, new commit and branch
     * @throws NotFoundException if the module or branch does not exist
     */
    public ModuleRevisionResponse updateModule(@NotBlank String slug, @NotNull UUID actorId,
                                               @Valid UpdateModuleRequest request) {
        ActivityModule module = findModuleBySlug(slug);
        Branch branch = request.branchName() != null ? branchService.findBranch(request.branchName()) : module.getBranch();

        ModuleVersion prior = versionService.findHead(module, branch).orElse(null);
        Map<String, Object> priorContent = prior != null ? versionService.content(prior) : Map.of();
        Commit parent = prior != null ? prior.getCommit() : null;

        Map<String, Object> content = contentCodec.overlay(priorContent, request.content());
        String title = request.title() != null ? request.title()
                : prior != null ? prior.getTitle() : module.getTitle();
        String description = request.description() != null ? request.description()
                : prior != null ? prior.getDescription() : module.getDescription();

        if (request.title() != null) {
            module.setTitle(request.title());
        }
        if (request.description() != null) {
            module.setDescription(request.description());
        }
        if (request.status() != null) {
            module.setStatus(request.status());
        }
        moduleRepository.save(module);

        String contentHash = contentHasher.contentHash(content);
        String message = request.commitMessage() != null ? request.commitMessage() : AppConstants.UPDATE_COMMIT_MESSAGE;
        Commit commit = commitService.createCommit(content, contentHash, message, actorId, parent);
        ModuleVersion version = versionService.appendHead(module, branch, commit, content, contentHash, title, description);

        log.info("Updated module '{}' on branch '{}' at commit {}", slug, branch.getName(), commit.getHash());
        return toRevisionResponse(module, version, commit, branch);
    }

    /**
     * Reads a module by slug on a branch, either at its head or pinned to a commit.
     *
     * @param slug       the module slug
     * @param branchName the branch, null for the module's home branch
     * @param commitHash a commit to pin the read to, or null for the head
     * @return the module, the resolved version and the branch
     * @throws NotFoundException if the module, branch, commit or version does not exist
     */
    @Transactional(readOnly = true)
    public ModuleSnapshotResponse getModuleBySlug(@NotBlank String slug, String branchName, String commitHash) {
        return snapshot(findModuleBySlug(slug), branchName, commitHash);
    }

    /**
     * Reads a module by id. Same semantics as {@link #getModuleBySlug}.
     */
    @Transactional(readOnly = true)
    public ModuleSnapshotResponse getModuleById(@NotNull UUID moduleId, String branchName, String commitHash) {
        return snapshot(findModule(moduleId), branchName, commitHash);
    }

    /**
     * Searches modules and resolves each hit's head on the searched branch.
     *
     * @param criteria filters, branch and paging
     * @return a page of modules with their head version, null where a module has none on the branch
     */
    @Transactional(readOnly = true)
    public PageResponse<ModuleSearchResult> searchModules(@Valid ModuleSearchCriteria criteria) {
        Branch branch = criteria.branchName() != null ? branchService.findBranch(criteria.branchName()) : null;

        Specification<ActivityModule> spec = Specification.where(ActivityModuleSpecifications.titleContains(criteria.title()))
                .and(ActivityModuleSpecifications.hasType(criteria.type()))
                .and(ActivityModuleSpecifications.hasStatus(criteria.status()))
                .and(ActivityModuleSpecifications.createdBy(criteria.createdBy()));

        int requested = criteria.size() != null ? criteria.size() : AppConstants.DEFAULT_PAGE_SIZE;
        int size = Math.min(Math.max(requested, 1), AppConstants.MAX_PAGE_SIZE);
        Page<ActivityModule> modules = moduleRepository.findAll(spec,
                PageRequest.of(Math.max(criteria.page(), 0), size, toSort(criteria.sort())));

        return PageResponse.from(modules.map(module -> {
            Branch target = branch != null ? branch : module.getBranch();
            VersionResponse version = versionService.findHead(module, target)
                    .map(versionService::toResponse)
                    .orElse(null);
            return new ModuleSearchResult(moduleMapper.toResponse(module), version);
        }));
    }

    /**
     * Lists every version of a module on a branch, oldest first.
     *
     * @param slug       the module slug
     * @param branchName the branch, null for the module's home branch
     * @return the version chain
     * @throws NotFoundException if the module or branch does not exist
     */
    @Transactional(readOnly = true)
    public List<VersionResponse> listVersions(@NotBlank String slug, String branchName) {
        ActivityModule module = findModuleBySlug(slug);
        Branch branch = branchName != null ? branchService.findBranch(branchName) : module.getBranch();
        return versionRepository.findByModuleIdAndBranchIdOrderByCreatedAtAsc(module.getId(), branch.getId()).stream()
                .map(versionService::toResponse)
                .toList();
    }

    /**
     * Lists every module sharing the given module's lineage, the root first.
     *
     * @param moduleId any module of the lineage
     * @return the lineage members
     * @throws NotFoundException if the module does not exist
     */
    @Transactional(readOnly = true)
    public List<ModuleResponse> listLineage(@NotNull UUID moduleId) {
        ActivityModule module = findModule(moduleId);
        return moduleMapper.toResponseList(moduleRepository.findLineage(module.lineageId()));
    }

    /**
     * Deletes a module together with its versions and every merge request that references it.
     * Commits are kept.
     *
     * @param slug the module slug
     * @return the deleted module
     * @throws NotFoundException if the module does not exist
     */
    public ModuleResponse deleteModule(@NotBlank String slug) {
        ActivityModule module = findModuleBySlug(slug);
        ModuleResponse response = moduleMapper.toResponse(module);

        List<MergeRequest> requests = mergeRequestRepository.findByModule(module.getId(), null);
        for (MergeRequest mr : requests) {
            commentRepository.deleteByMergeRequestId(mr.getId());
        }
        mergeRequestRepository.deleteAll(requests);
        versionRepository.deleteByModuleId(module.getId());
        moduleRepository.delete(module);

        log.info("Deleted module '{}' and {} merge requests", slug, requests.size());
        return response;
    }

    /**
     * Forks a module onto a branch. The fork joins the source's lineage, takes the named branch
     * as its home, and starts from the source head's commit without creating a new one.
     *
     * @param sourceSlug the module to fork
     * @param actorId    the user forking
     * @param request    the new slug, branch and optional title and description
     * @return the fork, its source, its initial version and its home branch
     * @throws NotFoundException         if the source or its head does not exist
     * @throws DuplicateSlugException    if the new slug is taken
     * @throws InvalidOperationException if the lineage already has a module homed on the branch
     */
    public ForkModuleResponse forkModule(@NotBlank String sourceSlug, @NotNull UUID actorId,
                                         @Valid ForkModuleRequest request) {
        ActivityModule source = findModuleBySlug(sourceSlug);
        ModuleVersion sourceHead = versionService.requireHead(source, source.getBranch());

        if (moduleRepository.existsBySlug(request.newSlug())) {
            throw new DuplicateSlugException("Module slug already exists: " + request.newSlug());
        }

        Branch branch = branchService.resolveBareBranch(request.branchName(), actorId);
        if (moduleRepository.existsInLineageOnBranch(source.lineageId(), branch.getId())) {
            throw new InvalidOperationException("Lineage of '" + sourceSlug + "' already has a module on branch '"
                    + branch.getName() + "'");
        }

        ActivityModule fork = moduleRepository.save(ActivityModule.builder()
                .slug(request.newSlug())
                .title(request.title() != null ? request.title() : source.getTitle())
                .description(request.description() != null ? request.description() : source.getDescription())
                .type(source.getType())
                .status(ModuleStatus.DRAFT)
                .createdBy(actorId)
                .originModuleId(source.lineageId())
                .forkedFromModuleId(source.getId())
                .branch(branch)
                .build());

        ModuleVersion version = versionService.appendHead(fork, branch, sourceHead.getCommit(), sourceHead.getContent(),
                sourceHead.getContentHash(), fork.getTitle(), fork.getDescription());

        log.info("Forked module '{}' as '{}' on branch '{}'", sourceSlug, fork.getSlug(), branch.getName());
        return new ForkModuleResponse(
                moduleMapper.toResponse(fork),
                moduleMapper.toResponse(source),
                versionService.toResponse(version),
                branchMapper.toResponse(branch));
    }

    /**
     * Loads a module entity by slug.
     *
     * @throws NotFoundException if no module has the slug
     */
    @Transactional(readOnly = true)
    public ActivityModule findModuleBySlug(String slug) {
        return moduleRepository.findBySlug(slug)
                .orElseThrow(() -> new NotFoundException("Module not found: " + slug));
    }

    /**
     * Loads a module entity by id.
     *
     * @throws NotFoundException if the module does not exist
     */
    @Transactional(readOnly = true)
    public ActivityModule findModule(UUID moduleId) {
        return moduleRepository.findById(moduleId)
                .orElseThrow(() -> new NotFoundException("Module not found: " + moduleId));
    }

    private ModuleSnapshotResponse snapshot(ActivityModule module, String branchName, String commitHash) {
        Branch branch = branchName != null ? branchService.findBranch(branchName) : module.getBranch();

        ModuleVersion version;
        if (commitHash != null) {
            Commit commit = commitService.findCommitByHash(commitHash);
            version = versionRepository.findFirstByModuleIdAndBranchIdAndCommitIdOrderByCreatedAtDesc(
                            module.getId(), branch.getId(), commit.getId())
                    .orElseThrow(() -> new NotFoundException("Commit " + commitHash + " has no version of module '"
                            + module.getSlug() + "' on branch '" + branch.getName() + "'"));
        } else {
            version = versionService.requireHead(module, branch);
        }

        return new ModuleSnapshotResponse(moduleMapper.toResponse(module), versionService.toResponse(version),
                branchMapper.toResponse(branch));
    }

    private Sort toSort(String sort) {
        if (sort == null || sort.isBlank()) {
            return Sort.by(Sort.Direction.DESC, "createdAt");
        }
        boolean descending = sort.startsWith("-");
        String property = descending ? sort.substring(1) : sort;
        if (!SORTABLE_PROPERTIES.contains(property)) {
            throw new ValidationException("Unsupported sort property: " + property);
        }
        return Sort.by(descending ? Sort.Direction.DESC : Sort.Direction.ASC, property);
    }

    private ModuleRevisionResponse toRevisionResponse(ActivityModule module, ModuleVersion version, Commit commit,
                                                      Branch branch) {
        return new ModuleRevisionResponse(
                moduleMapper.toResponse(module),
                versionService.toResponse(version),
                commitService.toResponse(commit),
                branchMapper.toResponse(branch));
    }
}
