package com.codeops.lineage.dto;

import com.codeops.lineage.dto.response.ModuleSearchResult;
import com.codeops.lineage.dto.response.PageResponse;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageResponseTest {

    @Test
    void from_mappedSearchPage_keepsPagingOfSource() {
        Page<String> slugs = new PageImpl<>(List.of("intro-page", "weekly-quiz"), PageRequest.of(2, 2), 7);

        PageResponse<ModuleSearchResult> response = PageResponse.from(slugs.map(slug -> new ModuleSearchResult(null, null)));

        assertThat(response.content()).hasSize(2);
        assertThat(response.page()).isEqualTo(2);
        assertThat(response.size()).isEqualTo(2);
        assertThat(response.totalElements()).isEqualTo(7);
        assertThat(response.totalPages()).isEqualTo(4);
        assertThat(response.isLast()).isFalse();
    }

    @Test
    void from_emptySearch_isLastPage() {
        PageResponse<ModuleSearchResult> response = PageResponse.from(Page.empty(PageRequest.of(0, 10)));

        assertThat(response.content()).isEmpty();
        assertThat(response.totalElements()).isZero();
        assertThat(response.isLast()).isTrue();
    }
}
