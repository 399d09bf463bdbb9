package com.codeops.lineage.config;

import com.codeops.lineage.dto.request.CreateMergeRequestRequest;
import com.codeops.lineage.dto.request.CreateModuleRequest;
import com.codeops.lineage.dto.request.CreateTagRequest;
import com.codeops.lineage.dto.request.ForkModuleRequest;
import com.codeops.lineage.dto.request.UpdateModuleRequest;
import com.codeops.lineage.dto.response.CommitResponse;
import com.codeops.lineage.dto.response.ForkModuleResponse;
import com.codeops.lineage.dto.response.ModuleResponse;
import com.codeops.lineage.dto.response.ModuleRevisionResponse;
import com.codeops.lineage.entity.enums.TagType;
import com.codeops.lineage.repository.ActivityModuleRepository;
import com.codeops.lineage.service.MergeRequestService;
import com.codeops.lineage.service.ModuleService;
import com.codeops.lineage.service.TagService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataSeederTest {

    @Mock
    private ActivityModuleRepository moduleRepository;

    @Mock
    private ModuleService moduleService;

    @Mock
    private MergeRequestService mergeRequestService;

    @Mock
    private TagService tagService;

    @InjectMocks
    private DataSeeder dataSeeder;

    @Test
    void run_existingLineage_skips() {
        when(moduleRepository.existsBySlug(DataSeeder.SEED_SLUG)).thenReturn(true);

        dataSeeder.run();

        verifyNoInteractions(moduleService, mergeRequestService, tagService);
    }

    @Test
    void run_emptyStore_seedsLineage() {
        UUID rootId = UUID.randomUUID();
        UUID forkId = UUID.randomUUID();
        ModuleRevisionResponse created = revision(rootId, "hash-0");
        ModuleRevisionResponse updated = revision(rootId, "hash-1");

        when(moduleRepository.existsBySlug(DataSeeder.SEED_SLUG)).thenReturn(false);
        when(moduleService.createModule(eq(DataSeeder.SEED_USER_ID), any(CreateModuleRequest.class))).thenReturn(created);
        when(moduleService.updateModule(any(), eq(DataSeeder.SEED_USER_ID), any(UpdateModuleRequest.class)))
                .thenReturn(updated);
        when(moduleService.forkModule(eq(DataSeeder.SEED_SLUG), eq(DataSeeder.SEED_USER_ID), any(ForkModuleRequest.class)))
                .thenReturn(new ForkModuleResponse(module(forkId, DataSeeder.SEED_FORK_SLUG), null, null, null));

        dataSeeder.run();

        ArgumentCaptor<CreateTagRequest> tag = ArgumentCaptor.forClass(CreateTagRequest.class);
        verify(tagService).createTag(eq(rootId), eq(DataSeeder.SEED_USER_ID), tag.capture());
        assertThat(tag.getValue().commitHash()).isEqualTo("hash-1");
        assertThat(tag.getValue().tagType()).isEqualTo(TagType.RELEASE);

        verify(moduleService).updateModule(eq(DataSeeder.SEED_SLUG), eq(DataSeeder.SEED_USER_ID),
                any(UpdateModuleRequest.class));
        verify(moduleService).updateModule(eq(DataSeeder.SEED_FORK_SLUG), eq(DataSeeder.SEED_USER_ID),
                any(UpdateModuleRequest.class));

        ArgumentCaptor<CreateMergeRequestRequest> mr = ArgumentCaptor.forClass(CreateMergeRequestRequest.class);
        verify(mergeRequestService).createMergeRequest(eq(DataSeeder.SEED_USER_ID), mr.capture());
        assertThat(mr.getValue().fromModuleId()).isEqualTo(forkId);
        assertThat(mr.getValue().toModuleId()).isEqualTo(rootId);
        verify(mergeRequestService, never()).acceptMergeRequest(any(), any(), any());
    }

    private static ModuleRevisionResponse revision(UUID moduleId, String hash) {
        CommitResponse commit = new CommitResponse(UUID.randomUUID(), hash, "msg", DataSeeder.SEED_USER_ID,
                DataSeeder.SEED_USER_ID, null, false, List.of(), "content", Instant.now());
        return new ModuleRevisionResponse(module(moduleId, DataSeeder.SEED_SLUG), null, commit, null);
    }

    private static ModuleResponse module(UUID id, String slug) {
        return new ModuleResponse(id, slug, "Welcome", null, null, null, DataSeeder.SEED_USER_ID,
                null, null, id, null, null, Instant.now(), Instant.now());
    }
}
