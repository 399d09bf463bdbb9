package com.codeops.lineage.service;

import com.codeops.lineage.config.AppConstants;
import com.codeops.lineage.dto.mapper.MergeRequestCommentMapper;
import com.codeops.lineage.dto.request.AcceptMergeRequestRequest;
import com.codeops.lineage.dto.request.CreateCommentRequest;
import com.codeops.lineage.dto.request.CreateMergeRequestRequest;
import com.codeops.lineage.dto.request.ResolveMergeRequestRequest;
import com.codeops.lineage.dto.response.MergeRequestAcceptedResponse;
import com.codeops.lineage.dto.response.MergeRequestCommentResponse;
import com.codeops.lineage.dto.response.MergeRequestResponse;
import com.codeops.lineage.dto.response.MergeResultResponse;
import com.codeops.lineage.dto.response.ModuleMergeOutcome;
import com.codeops.lineage.entity.ActivityModule;
import com.codeops.lineage.entity.Branch;
import com.codeops.lineage.entity.MergeRequest;
import com.codeops.lineage.entity.MergeRequestComment;
import com.codeops.lineage.entity.ModuleVersion;
import com.codeops.lineage.entity.enums.MergeRequestStatus;
import com.codeops.lineage.exception.CommentsDisabledException;
import com.codeops.lineage.exception.ConflictResolutionRequiredException;
import com.codeops.lineage.exception.DuplicateRequestException;
import com.codeops.lineage.exception.InvalidOperationException;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.exception.ValidationException;
import com.codeops.lineage.repository.MergeRequestCommentRepository;
import com.codeops.lineage.repository.MergeRequestRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Service for the merge request workflow between two modules of the same lineage.
 *
 * <p>A request starts {@code OPEN} and moves exactly once to {@code MERGED}, {@code REJECTED}
 * or {@code CLOSED}. Accepting it merges the from-module's head on its home branch into the
 * to-module's head on the to-module's home branch.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
@Validated
public class MergeRequestService {

    private final MergeRequestRepository mergeRequestRepository;
    private final MergeRequestCommentRepository commentRepository;
    private final ModuleService moduleService;
    private final VersionService versionService;
    private final MergeEngine mergeEngine;
    private final MergeRequestCommentMapper commentMapper;

    /**
     * Opens a merge request from one module into another.
     *
     * @param actorId the user opening the request
     * @param request the title, description and the two modules
     * @return the open merge request
     * @throws NotFoundException         if either module does not exist
     * @throws ValidationException       if the modules are the same or belong to different lineages
     * @throws DuplicateRequestException if an open request already exists for the pair
     */
    public MergeRequestResponse createMergeRequest(@NotNull UUID actorId, @Valid CreateMergeRequestRequest request) {
        if (request.fromModuleId().equals(request.toModuleId())) {
            throw new ValidationException("Cannot merge a module into itself");
        }
        ActivityModule from = moduleService.findModule(request.fromModuleId());
        ActivityModule to = moduleService.findModule(request.toModuleId());

        if (!from.lineageId().equals(to.lineageId())) {
            throw new ValidationException("Modules '" + from.getSlug() + "' and '" + to.getSlug()
                    + "' do not share a common origin");
        }
        if (mergeRequestRepository.existsByFromModuleIdAndToModuleIdAndStatus(
                from.getId(), to.getId(), MergeRequestStatus.OPEN)) {
            throw new DuplicateRequestException("An open merge request already exists from '" + from.getSlug()
                    + "' to '" + to.getSlug() + "'");
        }

        MergeRequest mergeRequest = MergeRequest.builder()
                .title(request.title())
                .description(request.description())
                .status(MergeRequestStatus.OPEN)
                .fromModule(from)
                .toModule(to)
                .createdBy(actorId)
                .allowComments(true)
                .build();

        MergeRequest saved = mergeRequestRepository.save(mergeRequest);
        log.info("Created merge request '{}' from '{}' to '{}'", saved.getTitle(), from.getSlug(), to.getSlug());
        return toResponse(saved);
    }

    /**
     * Gets a single merge request by ID.
     *
     * @param mergeRequestId the merge request ID
     * @return the merge request response
     * @throws NotFoundException if the merge request does not exist
     */
    @Transactional(readOnly = true)
    public MergeRequestResponse getMergeRequest(@NotNull UUID mergeRequestId) {
        return toResponse(findMergeRequest(mergeRequestId));
    }

    /**
     * Lists merge requests where the module is either endpoint, newest first.
     *
     * @param moduleId the module ID
     * @param status   optional status filter
     * @return matching merge requests
     */
    @Transactional(readOnly = true)
    public List<MergeRequestResponse> listByModule(@NotNull UUID moduleId, MergeRequestStatus status) {
        return mergeRequestRepository.findByModule(moduleId, status).stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Appends a comment to a merge request.
     *
     * @throws NotFoundException         if the merge request does not exist
     * @throws CommentsDisabledException if comments were stopped on the request
     */
    public MergeRequestCommentResponse addComment(@NotNull UUID mergeRequestId, @NotNull UUID actorId,
                                                  @Valid CreateCommentRequest request) {
        MergeRequest mr = findMergeRequest(mergeRequestId);
        if (!mr.isAllowComments()) {
            throw new CommentsDisabledException("Comments are disabled on merge request: " + mergeRequestId);
        }

        MergeRequestComment comment = MergeRequestComment.builder()
                .body(request.body())
                .createdBy(actorId)
                .mergeRequest(mr)
                .build();
        MergeRequestComment saved = commentRepository.save(comment);
        log.debug("Added comment to merge request '{}'", mr.getTitle());
        return commentMapper.toResponse(saved);
    }

    /**
     * Lists the comments of a merge request, oldest first.
     *
     * @throws NotFoundException if the merge request does not exist
     */
    @Transactional(readOnly = true)
    public List<MergeRequestCommentResponse> listComments(@NotNull UUID mergeRequestId) {
        findMergeRequest(mergeRequestId);
        return commentMapper.toResponseList(commentRepository.findByMergeRequestIdOrderByCreatedAtAsc(mergeRequestId));
    }

    /**
     * Accepts an open merge request and merges it. When the two heads diverged, the caller
     * must supply the reconciled content, which becomes the content of the merge commit.
     *
     * @param mergeRequestId the merge request ID
     * @param actorId        the user accepting
     * @param request        optional reason and resolved content
     * @return the merged request and the merge outcome
     * @throws NotFoundException                    if the request, a module or the source head does not exist
     * @throws InvalidOperationException            if the request is not open
     * @throws ConflictResolutionRequiredException  if the heads diverged and no resolved content was given
     */
    public MergeRequestAcceptedResponse acceptMergeRequest(@NotNull UUID mergeRequestId, @NotNull UUID actorId,
                                                           @Valid AcceptMergeRequestRequest request) {
        MergeRequest mr = findMergeRequest(mergeRequestId);
        requireOpen(mr, "accept");
        AcceptMergeRequestRequest options = request != null ? request : new AcceptMergeRequestRequest(null, null);

        ActivityModule from = mr.getFromModule();
        ActivityModule to = mr.getToModule();
        Branch sourceBranch = from.getBranch();
        Branch targetBranch = to.getBranch();

        ModuleVersion sourceHead = versionService.requireHead(from, sourceBranch);
        MergeEngine.MergeStep step = mergeEngine.plan(sourceHead, to, targetBranch);

        if (step.action().isDivergent() && options.resolvedContent() == null) {
            log.warn("Merge request '{}' needs conflict resolution for module '{}'", mr.getTitle(), to.getSlug());
            throw new ConflictResolutionRequiredException(
                    "Module '" + to.getSlug() + "' diverged from '" + from.getSlug() + "'; resolved content is required",
                    List.of(to.getSlug()));
        }

        String message = String.format(AppConstants.MERGE_COMMIT_FORMAT, from.getSlug(), to.getSlug());
        ModuleMergeOutcome outcome = mergeEngine.apply(step, sourceBranch, actorId, message, options.resolvedContent());
        MergeResultResponse result = mergeEngine.summarize(sourceBranch, targetBranch, List.of(outcome));

        mr.setStatus(MergeRequestStatus.MERGED);
        mr.setMergedBy(actorId);
        mr.setMergedAt(Instant.now());
        mr.setResolutionReason(options.reason());
        MergeRequest saved = mergeRequestRepository.save(mr);

        log.info("Merged merge request '{}' into '{}' ({})", mr.getTitle(), to.getSlug(), outcome.action());
        return new MergeRequestAcceptedResponse(toResponse(saved), result);
    }

    /**
     * Rejects an open merge request.
     *
     * @throws NotFoundException         if the merge request does not exist
     * @throws InvalidOperationException if the request is not open
     */
    public MergeRequestResponse rejectMergeRequest(@NotNull UUID mergeRequestId, @NotNull UUID actorId,
                                                   @Valid ResolveMergeRequestRequest request) {
        MergeRequest mr = findMergeRequest(mergeRequestId);
        requireOpen(mr, "reject");

        mr.setStatus(MergeRequestStatus.REJECTED);
        mr.setRejectedBy(actorId);
        mr.setRejectedAt(Instant.now());
        applyResolution(mr, request);

        MergeRequest saved = mergeRequestRepository.save(mr);
        log.info("Rejected merge request '{}'", mr.getTitle());
        return toResponse(saved);
    }

    /**
     * Closes an open merge request without judging it.
     *
     * @throws NotFoundException         if the merge request does not exist
     * @throws InvalidOperationException if the request is not open
     */
    public MergeRequestResponse closeMergeRequest(@NotNull UUID mergeRequestId, @NotNull UUID actorId,
                                                  @Valid ResolveMergeRequestRequest request) {
        MergeRequest mr = findMergeRequest(mergeRequestId);
        requireOpen(mr, "close");

        mr.setStatus(MergeRequestStatus.CLOSED);
        mr.setClosedBy(actorId);
        mr.setClosedAt(Instant.now());
        applyResolution(mr, request);

        MergeRequest saved = mergeRequestRepository.save(mr);
        log.info("Closed merge request '{}'", mr.getTitle());
        return toResponse(saved);
    }

    /**
     * Deletes a merge request and its comments.
     *
     * @param mergeRequestId the merge request ID
     * @param actorId        the user deleting
     * @return the deleted merge request
     * @throws NotFoundException if the merge request does not exist
     */
    public MergeRequestResponse deleteMergeRequest(@NotNull UUID mergeRequestId, @NotNull UUID actorId) {
        MergeRequest mr = findMergeRequest(mergeRequestId);
        MergeRequestResponse response = toResponse(mr);
        commentRepository.deleteByMergeRequestId(mergeRequestId);
        mergeRequestRepository.delete(mr);
        log.info("User {} deleted merge request '{}'", actorId, mr.getTitle());
        return response;
    }

    private MergeRequest findMergeRequest(UUID mergeRequestId) {
        return mergeRequestRepository.findById(mergeRequestId)
                .orElseThrow(() -> new NotFoundException("Merge request not found: " + mergeRequestId));
    }

    private void requireOpen(MergeRequest mr, String action) {
        if (mr.getStatus().isTerminal()) {
            throw new InvalidOperationException("Cannot " + action + " merge request in status " + mr.getStatus());
        }
    }

    private void applyResolution(MergeRequest mr, ResolveMergeRequestRequest request) {
        if (request == null) {
            return;
        }
        mr.setResolutionReason(request.reason());
        if (request.stopComments()) {
            mr.setAllowComments(false);
        }
    }

    private MergeRequestResponse toResponse(MergeRequest mr) {
        return new MergeRequestResponse(
                mr.getId(),
                mr.getTitle(),
                mr.getDescription(),
                mr.getStatus(),
                mr.getFromModule().getId(),
                mr.getFromModule().getSlug(),
                mr.getToModule().getId(),
                mr.getToModule().getSlug(),
                mr.getCreatedBy(),
                mr.getMergedBy(),
                mr.getMergedAt(),
                mr.getRejectedBy(),
                mr.getRejectedAt(),
                mr.getClosedBy(),
                mr.getClosedAt(),
                mr.getResolutionReason(),
                mr.isAllowComments(),
                mr.getCreatedAt(),
                mr.getUpdatedAt()
        );
    }
}
