package com.codeops.lineage.service;

import com.codeops.lineage.config.AppConstants;
import com.codeops.lineage.config.LineageProperties;
import com.codeops.lineage.dto.response.CommitResponse;
import com.codeops.lineage.entity.Commit;
import com.codeops.lineage.entity.CommitParent;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.exception.ValidationException;
import com.codeops.lineage.repository.CommitParentRepository;
import com.codeops.lineage.repository.CommitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Service owning the commit DAG. Commits are append-only: this service creates linear and
 * merge commits and answers lookups and reachability questions over them, always by id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class CommitService {

    private final CommitRepository commitRepository;
    private final CommitParentRepository commitParentRepository;
    private final ContentHasher contentHasher;
    private final LineageProperties lineageProperties;

    /**
     * Creates a linear commit on top of {@code parent}.
     *
     * @param content     the committed content
     * @param contentHash hash of {@code content}
     * @param message     the commit message
     * @param actorId     author and committer
     * @param parent      the primary parent, or null for a root commit
     * @return the saved commit
     */
    public Commit createCommit(Map<String, Object> content, String contentHash, String message,
                               UUID actorId, Commit parent) {
        Instant now = Instant.now();
        String hash = contentHasher.commitHash(content, message, actorId, now,
                parent != null ? parent.getHash() : null);

        Commit commit = Commit.builder()
                .hash(hash)
                .message(message)
                .authorId(actorId)
                .committerId(actorId)
                .parentCommitId(parent != null ? parent.getId() : null)
                .mergeCommit(false)
                .commitDate(now)
                .contentHash(contentHash)
                .build();
        Commit saved = commitRepository.save(commit);
        log.debug("Created commit {} with parent {}", hash, parent != null ? parent.getHash() : "none");
        return saved;
    }

    /**
     * Creates a merge commit joining {@code source} into {@code target}. The target commit is
     * the primary parent; both parents are recorded as CommitParent rows, target first.
     *
     * @param content     the merged content
     * @param contentHash hash of {@code content}
     * @param message     the commit message
     * @param actorId     author and committer
     * @param target      the commit being merged into
     * @param source      the commit being merged
     * @return the saved merge commit
     */
    public Commit createMergeCommit(Map<String, Object> content, String contentHash, String message,
                                    UUID actorId, Commit target, Commit source) {
        Instant now = Instant.now();
        String hash = contentHasher.commitHash(content, message, actorId, now, target.getHash());

        Commit commit = Commit.builder()
                .hash(hash)
                .message(message)
                .authorId(actorId)
                .committerId(actorId)
                .parentCommitId(target.getId())
                .mergeCommit(true)
                .commitDate(now)
                .contentHash(contentHash)
                .build();
        Commit saved = commitRepository.save(commit);

        commitParentRepository.save(CommitParent.builder()
                .commitId(saved.getId()).parentCommitId(target.getId()).parentOrder(0).build());
        commitParentRepository.save(CommitParent.builder()
                .commitId(saved.getId()).parentCommitId(source.getId()).parentOrder(1).build());

        log.debug("Created merge commit {} joining {} into {}", hash, source.getHash(), target.getHash());
        return saved;
    }

    /**
     * Gets a commit by its hash.
     *
     * @param hash the commit hash
     * @return the commit response
     * @throws ValidationException if the hash is blank
     * @throws NotFoundException   if no commit has the hash
     */
    @Transactional(readOnly = true)
    public CommitResponse getCommitByHash(String hash) {
        return toResponse(findCommitByHash(hash));
    }

    /**
     * Walks the first-parent chain from a commit, newest first.
     *
     * @param commitId the commit to start from
     * @param limit    maximum number of commits, null for the configured default
     * @return the commits visited, starting with {@code commitId}
     * @throws NotFoundException if the commit does not exist
     */
    @Transactional(readOnly = true)
    public List<CommitResponse> getCommitHistory(UUID commitId, Integer limit) {
        int bounded = limit == null ? lineageProperties.getHistoryLimit()
                : Math.min(Math.max(limit, 1), AppConstants.MAX_HISTORY_LIMIT);

        List<CommitResponse> history = new ArrayList<>();
        Commit current = findCommit(commitId);
        while (current != null && history.size() < bounded) {
            history.add(toResponse(current));
            current = current.getParentCommitId() != null
                    ? commitRepository.findById(current.getParentCommitId()).orElse(null)
                    : null;
        }
        return history;
    }

    /**
     * Lists the parents of a commit, primary parent first.
     *
     * @param commitId the commit ID
     * @return ordered parent ids, empty for a root commit
     * @throws NotFoundException if the commit does not exist
     */
    @Transactional(readOnly = true)
    public List<UUID> getParents(UUID commitId) {
        return parentIds(findCommit(commitId));
    }

    /**
     * Tests whether {@code ancestorId} is reachable from {@code descendantId} over any parent
     * edge. A commit counts as its own ancestor.
     *
     * @param ancestorId   the candidate ancestor
     * @param descendantId the commit to walk back from
     * @return true if the ancestor is reachable
     */
    @Transactional(readOnly = true)
    public boolean isAncestor(UUID ancestorId, UUID descendantId) {
        Set<UUID> visited = new HashSet<>();
        Deque<UUID> pending = new ArrayDeque<>();
        pending.push(descendantId);
        while (!pending.isEmpty()) {
            UUID id = pending.pop();
            if (id.equals(ancestorId)) {
                return true;
            }
            if (!visited.add(id)) {
                continue;
            }
            commitRepository.findById(id).ifPresent(commit -> parentIds(commit).forEach(pending::push));
        }
        return false;
    }

    /**
     * Collects the first-parent chain leading from {@code stopAtId} (exclusive) to
     * {@code tip} (inclusive), oldest first.
     *
     * @param tip      the newest commit of the chain
     * @param stopAtId the commit at which the walk stops
     * @return the chain, or empty if {@code stopAtId} is not on the tip's first-parent chain
     */
    @Transactional(readOnly = true)
    public Optional<List<Commit>> firstParentChain(Commit tip, UUID stopAtId) {
        List<Commit> chain = new ArrayList<>();
        Commit current = tip;
        while (current != null) {
            if (current.getId().equals(stopAtId)) {
                Collections.reverse(chain);
                return Optional.of(chain);
            }
            chain.add(current);
            current = current.getParentCommitId() != null
                    ? commitRepository.findById(current.getParentCommitId()).orElse(null)
                    : null;
        }
        return Optional.empty();
    }

    /**
     * Loads a commit entity.
     *
     * @throws NotFoundException if the commit does not exist
     */
    @Transactional(readOnly = true)
    public Commit findCommit(UUID commitId) {
        return commitRepository.findById(commitId)
                .orElseThrow(() -> new NotFoundException("Commit not found: " + commitId));
    }

    /**
     * Loads a commit entity by hash.
     *
     * @throws ValidationException if the hash is blank
     * @throws NotFoundException   if no commit has the hash
     */
    @Transactional(readOnly = true)
    public Commit findCommitByHash(String hash) {
        if (hash == null || hash.isBlank()) {
            throw new ValidationException("Commit hash is required");
        }
        return commitRepository.findByHash(hash)
                .orElseThrow(() -> new NotFoundException("Commit not found: " + hash));
    }

    /**
     * Builds the response for a commit, resolving merge parents from the join rows.
     */
    @Transactional(readOnly = true)
    public CommitResponse toResponse(Commit commit) {
        return new CommitResponse(
                commit.getId(),
                commit.getHash(),
                commit.getMessage(),
                commit.getAuthorId(),
                commit.getCommitterId(),
                commit.getParentCommitId(),
                commit.isMergeCommit(),
                parentIds(commit),
                commit.getContentHash(),
                commit.getCommitDate()
        );
    }

    private List<UUID> parentIds(Commit commit) {
        if (commit.isMergeCommit()) {
            List<UUID> parents = commitParentRepository.findByCommitIdOrderByParentOrderAsc(commit.getId()).stream()
                    .map(CommitParent::getParentCommitId)
                    .toList();
            if (!parents.isEmpty()) {
                return parents;
            }
        }
        return commit.getParentCommitId() != null ? List.of(commit.getParentCommitId()) : List.of();
    }
}
