package com.codeops.lineage.service;

import com.codeops.lineage.dto.mapper.TagMapper;
import com.codeops.lineage.dto.request.CreateTagRequest;
import com.codeops.lineage.entity.ActivityModule;
import com.codeops.lineage.entity.Commit;
import com.codeops.lineage.entity.Tag;
import com.codeops.lineage.entity.enums.TagType;
import com.codeops.lineage.exception.NotFoundException;
import com.codeops.lineage.exception.ValidationException;
import com.codeops.lineage.repository.TagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TagService.
 */
@ExtendWith(MockitoExtension.class)
class TagServiceTest {

    @Mock
    private TagRepository tagRepository;

    @Mock
    private ModuleService moduleService;

    @Mock
    private CommitService commitService;

    @Mock
    private TagMapper tagMapper;

    @InjectMocks
    private TagService tagService;

    private UUID actorId;
    private UUID rootId;
    private ActivityModule fork;

    @BeforeEach
    void setUp() {
        actorId = UUID.randomUUID();
        rootId = UUID.randomUUID();
        fork = ActivityModule.builder().slug("intro-draft").originModuleId(rootId).build();
        fork.setId(UUID.randomUUID());
    }

    @Test
    void createTag_scopesToLineageAndDefaultsToSnapshot() {
        Commit commit = Commit.builder().hash("abc").build();
        when(moduleService.findModule(fork.getId())).thenReturn(fork);
        when(tagRepository.existsByNameAndLineageId("v1", rootId)).thenReturn(false);
        when(commitService.findCommitByHash("abc")).thenReturn(commit);
        when(tagRepository.save(any(Tag.class))).thenAnswer(inv -> inv.getArgument(0));

        tagService.createTag(fork.getId(), actorId, new CreateTagRequest("v1", "abc", null, null));

        ArgumentCaptor<Tag> captor = ArgumentCaptor.forClass(Tag.class);
        verify(tagRepository).save(captor.capture());
        assertThat(captor.getValue().getLineageId()).isEqualTo(rootId);
        assertThat(captor.getValue().getTagType()).isEqualTo(TagType.SNAPSHOT);
        assertThat(captor.getValue().getCommit()).isSameAs(commit);
    }

    @Test
    void createTag_duplicateName_throws() {
        when(moduleService.findModule(fork.getId())).thenReturn(fork);
        when(tagRepository.existsByNameAndLineageId("v1", rootId)).thenReturn(true);

        assertThatThrownBy(() -> tagService.createTag(fork.getId(), actorId,
                new CreateTagRequest("v1", "abc", null, TagType.RELEASE)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("v1");
        verify(tagRepository, never()).save(any());
    }

    @Test
    void getTag_notFound_throws() {
        when(moduleService.findModule(fork.getId())).thenReturn(fork);
        when(tagRepository.findByNameAndLineageId("v9", rootId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tagService.getTag(fork.getId(), "v9"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("v9");
    }

    @Test
    void deleteTag_success() {
        Tag tag = Tag.builder().name("v1").build();
        tag.setId(UUID.randomUUID());
        when(tagRepository.findById(tag.getId())).thenReturn(Optional.of(tag));

        tagService.deleteTag(tag.getId());

        verify(tagRepository).delete(tag);
    }
}
