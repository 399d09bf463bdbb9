package com.codeops.lineage.integration;

import com.codeops.lineage.dto.request.CreateBranchRequest;
import com.codeops.lineage.dto.request.CreateModuleRequest;
import com.codeops.lineage.dto.request.MergeBranchesRequest;
import com.codeops.lineage.entity.enums.ModuleType;
import com.codeops.lineage.exception.ErrorKind;
import com.codeops.lineage.exception.ErrorResponse;
import com.codeops.lineage.service.BranchService;
import com.codeops.lineage.service.ContentHasher;
import com.codeops.lineage.service.MergeEngine;
import com.codeops.lineage.service.ModuleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;

/**
 * A branch merge that fails part way through must leave no trace in the store.
 */
@SpringBootTest
@ActiveProfiles("test")
class MergeAtomicityIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private BranchService branchService;

    @Autowired
    private ModuleService moduleService;

    @Autowired
    private MergeEngine mergeEngine;

    @SpyBean
    private ContentHasher contentHasher;

    @Test
    void mergeBranches_failureOnSecondModule_rollsBackFirst() {
        UUID actorId = UUID.randomUUID();
        branchService.getOrCreateDefaultBranch(actorId);
        branchService.createBranch(actorId, new CreateBranchRequest("release", "main", null));
        moduleService.createModule(actorId, new CreateModuleRequest("intro-page", "Intro", null,
                ModuleType.PAGE, null, Map.of("body", "a"), null));
        moduleService.createModule(actorId, new CreateModuleRequest("weekly-quiz", "Quiz", null,
                ModuleType.QUIZ, null, Map.of("questions", "b"), null));
        long commits = commitRepository.count();
        long versions = versionRepository.count();

        doCallRealMethod()
                .doThrow(new IllegalStateException("injected"))
                .when(contentHasher).commitHash(any(), any(), any(), any(), any());

        Throwable thrown = catchThrowable(() ->
                mergeEngine.mergeBranches(actorId, new MergeBranchesRequest("main", "release", null)));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessage("injected");
        assertThat(ErrorResponse.from(thrown).kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(commitRepository.count()).isEqualTo(commits);
        assertThat(versionRepository.count()).isEqualTo(versions);
        assertThat(versionRepository.findByBranchIdAndCurrentHeadTrueOrderByCreatedAtAsc(
                branchRepository.findByName("release").orElseThrow().getId())).isEmpty();
    }
}
