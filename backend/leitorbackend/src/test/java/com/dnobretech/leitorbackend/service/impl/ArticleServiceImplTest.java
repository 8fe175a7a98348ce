package com.dnobretech.leitorbackend.service.impl;

import com.dnobretech.leitorbackend.auth.ClaimsUser;
import com.dnobretech.leitorbackend.domain.Article;
import com.dnobretech.leitorbackend.dto.GetArticlesResponse;
import com.dnobretech.leitorbackend.repository.ArticleFilter;
import com.dnobretech.leitorbackend.repository.ArticleRepository;
import com.dnobretech.leitorbackend.service.ArticleAssembler;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ArticleServiceImplTest {

    private final ClaimsUser owner = new ClaimsUser(1L, "owner", Instant.EPOCH, "en", "en");
    private final ClaimsUser other = new ClaimsUser(2L, "other", Instant.EPOCH, "en", "en");

    private ArticleRepository repo;
    private ArticleServiceImpl service;

    @BeforeEach
    void setUp() {
        repo = mock(ArticleRepository.class);
        service = new ArticleServiceImpl(repo, mock(ArticleAssembler.class));
        when(repo.search(any())).thenReturn(List.of());
    }

    private static Article article(long id, boolean system, long uploader) {
        return Article.builder()
                .id(id).title("a" + id).content("x").contentLength(1)
                .words(List.of("x")).tags(List.of())
                .createdOn(Instant.EPOCH).system(system).uploaderId(uploader).lang("en")
                .build();
    }

    private ArticleFilter lastFilter() {
        ArgumentCaptor<ArticleFilter> captor = ArgumentCaptor.forClass(ArticleFilter.class);
        verify(repo, atLeastOnce()).search(captor.capture());
        return captor.getValue();
    }

    @Test
    void privateArticleIsVisibleOnlyToItsUploader() {
        when(repo.findById(10L)).thenReturn(Optional.of(article(10L, false, 1L)));

        assertThat(service.getFull(10L, owner).getId()).isEqualTo(10L);
        assertThatThrownBy(() -> service.getFull(10L, other)).isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void systemArticleIsVisibleToEveryone() {
        when(repo.findById(11L)).thenReturn(Optional.of(article(11L, true, 1L)));

        assertThat(service.getFull(11L, other).isSystem()).isTrue();
    }

    @Test
    void missingArticleIsNotFound() {
        when(repo.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getFull(99L, owner)).isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void publicListingUsesDefaultAndCappedLimits() {
        service.list(null, null, "en", null);
        assertThat(lastFilter()).isEqualTo(new ArticleFilter(null, false, "en", null, 20, 0));

        service.list(500, -3, null, "cat");
        assertThat(lastFilter()).isEqualTo(new ArticleFilter(null, false, null, "cat", 100, 0));
    }

    @Test
    void listingByUserIncludesPrivateOnlyForTheCaller() {
        service.listByUser(null, 5, 10, null, null, owner);
        assertThat(lastFilter()).isEqualTo(new ArticleFilter(1L, true, null, null, 5, 10));

        service.listByUser(1L, 5, 0, null, null, other);
        assertThat(lastFilter()).isEqualTo(new ArticleFilter(1L, false, null, null, 5, 0));
    }

    @Test
    void countIsTheNumberOfArticlesReturned() {
        when(repo.search(any())).thenReturn(List.of(article(1L, true, 1L), article(2L, true, 2L)));

        GetArticlesResponse res = service.list(null, null, null, null);

        assertThat(res.count()).isEqualTo(2);
        assertThat(res.articles()).extracting("id").containsExactly(1L, 2L);
    }
}
