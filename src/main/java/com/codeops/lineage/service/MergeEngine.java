package com.codeops.lineage.service;

import com.codeops.lineage.config.AppConstants;
import com.codeops.lineage.dto.request.MergeBranchesRequest;
import com.codeops.lineage.dto.response.MergeResultResponse;
import com.codeops.lineage.dto.response.ModuleMergeOutcome;
import com.codeops.lineage.entity.ActivityModule;
import com.codeops.lineage.entity.Branch;
import com.codeops.lineage.entity.Commit;
import com.codeops.lineage.entity.ModuleVersion;
import com.codeops.lineage.entity.enums.MergeAction;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.exception.ValidationException;
import com.codeops.lineage.repository.ModuleVersionRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Folds the head of a module on one branch into the head of a module on another branch.
 *
 * <p>Each module is classified on its own, so one merge may copy some modules,
 * fast-forward others and three-way merge the rest:</p>
 * <ul>
 *   <li>no head on the target: {@link MergeAction#COPY}, a new commit parented on the source commit</li>
 *   <li>equal content hashes: {@link MergeAction#UNCHANGED}</li>
 *   <li>target head is an ancestor of the source head: {@link MergeAction#FAST_FORWARD}, the target adopts
 *       the source commits after its head, one version per commit that still has one, without new commits</li>
 *   <li>source head is an ancestor of the target head: {@link MergeAction#TARGET_AHEAD}</li>
 *   <li>otherwise the heads diverged: {@link MergeAction#THREE_WAY} when the source commit is not older
 *       than the target commit, {@link MergeAction#STALE_SOURCE} when it is</li>
 * </ul>
 *
 * <p>All work of one merge runs in the caller's transaction and is rolled back as a whole on
 * any failure.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
@Validated
public class MergeEngine {

    private final BranchService branchService;
    private final CommitService commitService;
    private final VersionService versionService;
    private final ContentHasher contentHasher;
    private final ModuleVersionRepository versionRepository;

    /**
     * One module's planned merge step. {@code targetHead} is null for a copy.
     */
    public record MergeStep(
            ModuleVersion sourceHead,
            ActivityModule targetModule,
            Branch targetBranch,
            ModuleVersion targetHead,
            MergeAction action
    ) {}

    /**
     * Classifies how {@code sourceHead} would merge into {@code targetModule} on {@code targetBranch}.
     *
     * @param sourceHead   the head version being merged
     * @param targetModule the module receiving the merge
     * @param targetBranch the branch receiving the merge
     * @return the planned step
     */
    @Transactional(readOnly = true)
    public MergeStep plan(ModuleVersion sourceHead, ActivityModule targetModule, Branch targetBranch) {
        ModuleVersion targetHead = versionService.findHead(targetModule, targetBranch).orElse(null);
        return new MergeStep(sourceHead, targetModule, targetBranch, targetHead,
                classify(sourceHead, targetHead));
    }

    /**
     * Applies a planned step.
     *
     * @param step            the planned step
     * @param sourceBranch    the branch the source head lives on, used in copy messages
     * @param actorId         author of any commit created
     * @param mergeMessage    message of a merge commit
     * @param resolvedContent reconciled content for divergent heads, or null to keep the planned action
     * @return what happened to the target module
     */
    public ModuleMergeOutcome apply(MergeStep step, Branch sourceBranch, UUID actorId, String mergeMessage,
                                    Map<String, Object> resolvedContent) {
        MergeAction action = step.action();
        if (action == MergeAction.STALE_SOURCE && resolvedContent != null) {
            action = MergeAction.THREE_WAY;
        }
        ModuleMergeOutcome outcome = switch (action) {
            case COPY -> copy(step, sourceBranch, actorId);
            case FAST_FORWARD -> fastForward(step);
            case THREE_WAY -> threeWay(step, actorId, mergeMessage, resolvedContent);
            case UNCHANGED, TARGET_AHEAD, STALE_SOURCE -> skipped(step, action);
        };
        log.debug("Merged module '{}' onto '{}': {}", step.targetModule().getSlug(),
                step.targetBranch().getName(), outcome.action());
        return outcome;
    }

    /**
     * Merges every module with a head on the source branch into the same module on the target branch.
     *
     * @param actorId the user merging
     * @param request the source and target branch and an optional merge message
     * @return per-module outcomes and totals
     * @throws NotFoundException   if either branch does not exist
     * @throws ValidationException if source and target are the same branch
     */
    public MergeResultResponse mergeBranches(@NotNull UUID actorId, @Valid MergeBranchesRequest request) {
        if (request.sourceBranch().equals(request.targetBranch())) {
            throw new ValidationException("Cannot merge branch '" + request.sourceBranch() + "' into itself");
        }
        Branch source = branchService.findBranch(request.sourceBranch());
        Branch target = branchService.findBranch(request.targetBranch());
        String message = request.mergeMessage() != null
                ? request.mergeMessage()
                : String.format(AppConstants.MERGE_COMMIT_FORMAT, source.getName(), target.getName());

        List<ModuleMergeOutcome> outcomes = new ArrayList<>();
        for (ModuleVersion sourceHead : versionRepository.findByBranchIdAndCurrentHeadTrueOrderByCreatedAtAsc(source.getId())) {
            MergeStep step = plan(sourceHead, sourceHead.getModule(), target);
            outcomes.add(apply(step, source, actorId, message, null));
        }

        MergeResultResponse result = summarize(source, target, outcomes);
        log.info("Merged branch '{}' into '{}': {} versions, {} commits", source.getName(), target.getName(),
                result.mergedVersionCount(), result.newCommitCount());
        return result;
    }

    /**
     * Totals a list of outcomes into a merge result.
     */
    public MergeResultResponse summarize(Branch source, Branch target, List<ModuleMergeOutcome> outcomes) {
        int versions = outcomes.stream().mapToInt(ModuleMergeOutcome::versionsCreated).sum();
        int commits = outcomes.stream().mapToInt(ModuleMergeOutcome::commitsCreated).sum();
        return new MergeResultResponse(source.getName(), target.getName(), versions, commits, outcomes);
    }

    private MergeAction classify(ModuleVersion sourceHead, ModuleVersion targetHead) {
        if (targetHead == null) {
            return MergeAction.COPY;
        }
        if (sourceHead.getContentHash().equals(targetHead.getContentHash())) {
            return MergeAction.UNCHANGED;
        }
        Commit sourceCommit = sourceHead.getCommit();
        Commit targetCommit = targetHead.getCommit();
        if (commitService.isAncestor(targetCommit.getId(), sourceCommit.getId())) {
            return MergeAction.FAST_FORWARD;
        }
        if (commitService.isAncestor(sourceCommit.getId(), targetCommit.getId())) {
            return MergeAction.TARGET_AHEAD;
        }
        return sourceCommit.getCommitDate().isBefore(targetCommit.getCommitDate())
                ? MergeAction.STALE_SOURCE
                : MergeAction.THREE_WAY;
    }

    private ModuleMergeOutcome copy(MergeStep step, Branch sourceBranch, UUID actorId) {
        ModuleVersion sourceHead = step.sourceHead();
        Map<String, Object> content = versionService.content(sourceHead);
        Commit commit = commitService.createCommit(content, sourceHead.getContentHash(),
                AppConstants.COPY_COMMIT_PREFIX + sourceBranch.getName(), actorId, sourceHead.getCommit());
        versionService.appendHead(step.targetModule(), step.targetBranch(), commit, sourceHead.getContent(),
                sourceHead.getContentHash(), sourceHead.getTitle(), sourceHead.getDescription());
        return outcome(step, MergeAction.COPY, 1, 1, commit);
    }

    private ModuleMergeOutcome fastForward(MergeStep step) {
        Commit tip = step.sourceHead().getCommit();
        List<Commit> chain = commitService.firstParentChain(tip, step.targetHead().getCommit().getId())
                .orElseGet(() -> List.of(tip));

        int adopted = 0;
        for (Commit commit : chain) {
            Optional<ModuleVersion> snapshot = commit.getId().equals(tip.getId())
                    ? Optional.of(step.sourceHead())
                    : versionRepository.findFirstByCommitIdOrderByCreatedAtAsc(commit.getId());
            if (snapshot.isEmpty()) {
                // versions of this commit went with a deleted branch
                log.debug("Skipping commit {} with no surviving version", commit.getHash());
                continue;
            }
            ModuleVersion version = snapshot.get();
            versionService.appendHead(step.targetModule(), step.targetBranch(), commit, version.getContent(),
                    version.getContentHash(), version.getTitle(), version.getDescription());
            adopted++;
        }
        return outcome(step, MergeAction.FAST_FORWARD, adopted, 0, tip);
    }

    private ModuleMergeOutcome threeWay(MergeStep step, UUID actorId, String message,
                                        Map<String, Object> resolvedContent) {
        ModuleVersion sourceHead = step.sourceHead();
        Map<String, Object> content = resolvedContent != null ? resolvedContent : versionService.content(sourceHead);
        String contentHash = contentHasher.contentHash(content);

        Commit commit = commitService.createMergeCommit(content, contentHash, message, actorId,
                step.targetHead().getCommit(), sourceHead.getCommit());
        versionService.appendHead(step.targetModule(), step.targetBranch(), commit, content, contentHash,
                sourceHead.getTitle(), sourceHead.getDescription());
        return outcome(step, MergeAction.THREE_WAY, 1, 1, commit);
    }

    private ModuleMergeOutcome skipped(MergeStep step, MergeAction action) {
        Commit head = Optional.ofNullable(step.targetHead()).map(ModuleVersion::getCommit).orElse(null);
        return outcome(step, action, 0, 0, head);
    }

    private ModuleMergeOutcome outcome(MergeStep step, MergeAction action, int versions, int commits, Commit head) {
        return new ModuleMergeOutcome(
                step.targetModule().getId(),
                step.targetModule().getSlug(),
                action,
                versions,
                commits,
                head != null ? head.getHash() : null);
    }
}
