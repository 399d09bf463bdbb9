package com.codeops.lineage.service;

import com.codeops.lineage.config.LineageProperties;
import com.codeops.lineage.dto.response.CommitResponse;
import com.codeops.lineage.entity.Commit;
import com.codeops.lineage.entity.CommitParent;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.exception.ValidationException;
import com.codeops.lineage.repository.CommitParentRepository;
import com.codeops.lineage.repository.CommitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CommitService covering commit creation, lookups and DAG walks.
 */
@ExtendWith(MockitoExtension.class)
class CommitServiceTest {

    @Mock
    private CommitRepository commitRepository;

    @Mock
    private CommitParentRepository commitParentRepository;

    @Mock
    private ContentHasher contentHasher;

    @Spy
    private LineageProperties lineageProperties = new LineageProperties();

    @InjectMocks
    private CommitService commitService;

    private UUID actorId;
    private Commit root;
    private Commit middle;
    private Commit tip;

    @BeforeEach
    void setUp() {
        actorId = UUID.randomUUID();
        root = commit("root", null);
        middle = commit("middle", root);
        tip = commit("tip", middle);

        lenient().when(commitRepository.findById(root.getId())).thenReturn(Optional.of(root));
        lenient().when(commitRepository.findById(middle.getId())).thenReturn(Optional.of(middle));
        lenient().when(commitRepository.findById(tip.getId())).thenReturn(Optional.of(tip));
        lenient().when(commitRepository.save(any(Commit.class))).thenAnswer(inv -> {
            Commit c = inv.getArgument(0);
            c.setId(UUID.randomUUID());
            return c;
        });
    }

    @Test
    void createCommit_chainsParentHash() {
        when(contentHasher.commitHash(anyMap(), eq("Update"), eq(actorId), any(Instant.class), eq("tip-hash")))
                .thenReturn("new-hash");

        Commit created = commitService.createCommit(Map.of("a", 1), "content-hash", "Update", actorId, tip);

        assertThat(created.getHash()).isEqualTo("new-hash");
        assertThat(created.getParentCommitId()).isEqualTo(tip.getId());
        assertThat(created.isMergeCommit()).isFalse();
        assertThat(created.getAuthorId()).isEqualTo(actorId);
        assertThat(created.getContentHash()).isEqualTo("content-hash");
    }

    @Test
    void createCommit_root_hasNoParent() {
        when(contentHasher.commitHash(anyMap(), anyString(), eq(actorId), any(Instant.class), isNull()))
                .thenReturn("root-2");

        Commit created = commitService.createCommit(Map.of(), "h", "Initial commit", actorId, null);

        assertThat(created.getParentCommitId()).isNull();
    }

    @Test
    void createMergeCommit_recordsBothParentsInOrder() {
        when(contentHasher.commitHash(anyMap(), anyString(), eq(actorId), any(Instant.class), eq("middle-hash")))
                .thenReturn("merge-hash");
        Commit source = commit("source", root);

        Commit merge = commitService.createMergeCommit(Map.of("a", 2), "h", "Merge", actorId, middle, source);

        assertThat(merge.isMergeCommit()).isTrue();
        assertThat(merge.getParentCommitId()).isEqualTo(middle.getId());

        ArgumentCaptor<CommitParent> captor = ArgumentCaptor.forClass(CommitParent.class);
        verify(commitParentRepository, times(2)).save(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(CommitParent::getParentCommitId, CommitParent::getParentOrder)
                .containsExactly(
                        tuple(middle.getId(), 0),
                        tuple(source.getId(), 1));
    }

    @Test
    void getCommitByHash_success() {
        when(commitRepository.findByHash("tip-hash")).thenReturn(Optional.of(tip));

        CommitResponse response = commitService.getCommitByHash("tip-hash");

        assertThat(response.id()).isEqualTo(tip.getId());
        assertThat(response.parentIds()).containsExactly(middle.getId());
    }

    @Test
    void getCommitByHash_blank_throws() {
        assertThatThrownBy(() -> commitService.getCommitByHash(" "))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void getCommitByHash_notFound_throws() {
        when(commitRepository.findByHash("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> commitService.getCommitByHash("missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void getCommitHistory_walksFirstParentsNewestFirst() {
        List<CommitResponse> history = commitService.getCommitHistory(tip.getId(), null);

        assertThat(history).extracting(CommitResponse::hash)
                .containsExactly("tip-hash", "middle-hash", "root-hash");
    }

    @Test
    void getCommitHistory_respectsLimit() {
        List<CommitResponse> history = commitService.getCommitHistory(tip.getId(), 2);

        assertThat(history).hasSize(2);
    }

    @Test
    void getParents_mergeCommit_listsJoinRows() {
        Commit other = commit("other", root);
        Commit merge = commit("merge", middle);
        merge.setMergeCommit(true);
        when(commitRepository.findById(merge.getId())).thenReturn(Optional.of(merge));
        when(commitParentRepository.findByCommitIdOrderByParentOrderAsc(merge.getId())).thenReturn(List.of(
                CommitParent.builder().commitId(merge.getId()).parentCommitId(middle.getId()).parentOrder(0).build(),
                CommitParent.builder().commitId(merge.getId()).parentCommitId(other.getId()).parentOrder(1).build()));

        assertThat(commitService.getParents(merge.getId())).containsExactly(middle.getId(), other.getId());
    }

    @Test
    void getParents_rootCommit_isEmpty() {
        assertThat(commitService.getParents(root.getId())).isEmpty();
    }

    @Test
    void isAncestor_followsParents() {
        assertThat(commitService.isAncestor(root.getId(), tip.getId())).isTrue();
        assertThat(commitService.isAncestor(tip.getId(), root.getId())).isFalse();
        assertThat(commitService.isAncestor(tip.getId(), tip.getId())).isTrue();
    }

    @Test
    void isAncestor_followsSecondParentOfMerge() {
        Commit side = commit("side", root);
        Commit merge = commit("merge", middle);
        merge.setMergeCommit(true);
        when(commitRepository.findById(merge.getId())).thenReturn(Optional.of(merge));
        when(commitParentRepository.findByCommitIdOrderByParentOrderAsc(merge.getId())).thenReturn(List.of(
                CommitParent.builder().commitId(merge.getId()).parentCommitId(middle.getId()).parentOrder(0).build(),
                CommitParent.builder().commitId(merge.getId()).parentCommitId(side.getId()).parentOrder(1).build()));

        assertThat(commitService.isAncestor(side.getId(), merge.getId())).isTrue();
    }

    @Test
    void firstParentChain_returnsCommitsAfterStopOldestFirst() {
        Optional<List<Commit>> chain = commitService.firstParentChain(tip, root.getId());

        assertThat(chain).isPresent();
        assertThat(chain.get()).containsExactly(middle, tip);
    }

    @Test
    void firstParentChain_stopNotOnChain_isEmpty() {
        assertThat(commitService.firstParentChain(tip, UUID.randomUUID())).isEmpty();
    }

    @Test
    void findCommit_notFound_throws() {
        UUID id = UUID.randomUUID();
        when(commitRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> commitService.findCommit(id))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("Commit not found");
    }

    private Commit commit(String name, Commit parent) {
        Commit commit = Commit.builder()
                .hash(name + "-hash")
                .message(name)
                .authorId(UUID.randomUUID())
                .committerId(UUID.randomUUID())
                .parentCommitId(parent != null ? parent.getId() : null)
                .commitDate(Instant.now())
                .contentHash(name + "-content")
                .build();
        commit.setId(UUID.randomUUID());
        return commit;
    }
}
