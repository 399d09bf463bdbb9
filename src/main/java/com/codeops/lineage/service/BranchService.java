package com.codeops.lineage.service;

import com.codeops.lineage.config.LineageProperties;
import com.codeops.lineage.dto.mapper.BranchMapper;
import com.codeops.lineage.dto.request.CreateBranchRequest;
import com.codeops.lineage.dto.response.BranchResponse;
import com.codeops.lineage.dto.response.CreateBranchResponse;
import com.codeops.lineage.entity.Branch;
import com.codeops.lineage.entity.ModuleVersion;
import com.codeops.lineage.exception.DuplicateBranchException;
import com.codeops.lineage.exception.InvalidOperationException;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.repository.ActivityModuleRepository;
import com.codeops.lineage.repository.BranchRepository;
import com.codeops.lineage.repository.ModuleVersionRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.UUID;

/**
 * Service for managing branches. Branches are repository-wide named refs; exactly one of them
 * is the default branch. Forking a branch copies head pointers only and never creates commits.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
@Validated
public class BranchService {

    private final BranchRepository branchRepository;
    private final ModuleVersionRepository versionRepository;
    private final ActivityModuleRepository moduleRepository;
    private final VersionService versionService;
    private final BranchMapper branchMapper;
    private final LineageProperties lineageProperties;

    /**
     * Returns the default branch, creating it if the store has none. Calling this repeatedly
     * yields the same branch.
     *
     * @param actorId the user recorded as creator if the branch is created
     * @return the default branch
     */
    public BranchResponse getOrCreateDefaultBranch(@NotNull UUID actorId) {
        return branchMapper.toResponse(resolveDefaultBranch(actorId));
    }

    /**
     * Gets a branch by name.
     *
     * @param name the branch name
     * @return the branch response
     * @throws NotFoundException if no branch has the name
     */
    @Transactional(readOnly = true)
    public BranchResponse getBranchByName(@NotBlank String name) {
        return branchMapper.toResponse(findBranch(name));
    }

    /**
     * Lists every branch, oldest first.
     */
    @Transactional(readOnly = true)
    public List<BranchResponse> listBranches() {
        return branchMapper.toResponseList(branchRepository.findAllByOrderByCreatedAtAsc());
    }

    /**
     * Forks a branch. Every current-head version on the source branch is copied onto the new
     * branch as a head version pointing at the same commit.
     *
     * @param actorId the user creating the branch
     * @param request the branch name, optional source branch and description
     * @return the new branch, its source and the number of versions copied
     * @throws DuplicateBranchException if the name is taken
     * @throws NotFoundException        if the source branch does not exist
     */
    public CreateBranchResponse createBranch(@NotNull UUID actorId, @Valid CreateBranchRequest request) {
        if (branchRepository.existsByName(request.branchName())) {
            throw new DuplicateBranchException("Branch already exists: " + request.branchName());
        }

        String fromName = request.fromBranch() != null && !request.fromBranch().isBlank()
                ? request.fromBranch()
                : lineageProperties.getDefaultBranch();
        Branch source = findBranch(fromName);

        Branch branch = branchRepository.save(Branch.builder()
                .name(request.branchName())
                .description(request.description())
                .defaultBranch(false)
                .createdBy(actorId)
                .build());

        List<ModuleVersion> heads = versionRepository.findByBranchIdAndCurrentHeadTrueOrderByCreatedAtAsc(source.getId());
        for (ModuleVersion head : heads) {
            versionService.copyToBranch(head, branch);
        }

        log.info("Created branch '{}' from '{}' with {} versions", branch.getName(), source.getName(), heads.size());
        return new CreateBranchResponse(branchMapper.toResponse(branch), branchMapper.toResponse(source), heads.size());
    }

    /**
     * Deletes a branch and every version scoped to it.
     *
     * @param name the branch name
     * @return the deleted branch
     * @throws NotFoundException         if the branch does not exist
     * @throws InvalidOperationException if the branch is the default branch or the home branch of a module
     */
    public BranchResponse deleteBranch(@NotBlank String name) {
        Branch branch = findBranch(name);
        if (branch.isDefaultBranch()) {
            throw new InvalidOperationException("Cannot delete the default branch: " + name);
        }
        long homed = moduleRepository.countByBranchId(branch.getId());
        if (homed > 0) {
            throw new InvalidOperationException("Branch '" + name + "' is the home branch of " + homed + " module(s)");
        }

        BranchResponse response = branchMapper.toResponse(branch);
        versionRepository.deleteByBranchId(branch.getId());
        branchRepository.delete(branch);
        log.info("Deleted branch '{}'", name);
        return response;
    }

    /**
     * Loads the default branch entity, creating it on first use.
     */
    public Branch resolveDefaultBranch(UUID actorId) {
        return branchRepository.findFirstByDefaultBranchTrueOrderByCreatedAtAsc()
                .orElseGet(() -> {
                    String name = lineageProperties.getDefaultBranch();
                    Branch branch = branchRepository.findByName(name).orElseGet(() -> Branch.builder()
                            .name(name)
                            .description("Default branch")
                            .createdBy(actorId)
                            .build());
                    branch.setDefaultBranch(true);
                    Branch saved = branchRepository.save(branch);
                    log.info("Created default branch '{}'", name);
                    return saved;
                });
    }

    /**
     * Loads a branch by name, creating it without any versions if it does not exist.
     */
    public Branch resolveBareBranch(String name, UUID actorId) {
        return branchRepository.findByName(name)
                .orElseGet(() -> {
                    Branch saved = branchRepository.save(Branch.builder()
                            .name(name)
                            .defaultBranch(false)
                            .createdBy(actorId)
                            .build());
                    log.info("Created branch '{}'", name);
                    return saved;
                });
    }

    /**
     * Loads a branch entity by name.
     *
     * @throws NotFoundException if no branch has the name
     */
    @Transactional(readOnly = true)
    public Branch findBranch(String name) {
        return branchRepository.findByName(name)
                .orElseThrow(() -> new NotFoundException("Branch not found: " + name));
    }
}
