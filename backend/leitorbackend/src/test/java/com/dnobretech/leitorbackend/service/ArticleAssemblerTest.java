package com.dnobretech.leitorbackend.service;

import com.dnobretech.leitorbackend.domain.Article;
import com.dnobretech.leitorbackend.exception.EmptyContentException;
import com.dnobretech.leitorbackend.exception.SegmentationFailedException;
import com.dnobretech.leitorbackend.text.ChineseWordBreaker;
import com.dnobretech.leitorbackend.text.LexicalIndexer;
import com.dnobretech.leitorbackend.text.TextSegmenter;
import com.dnobretech.leitorbackend.text.TokenRange;
import com.dnobretech.leitorbackend.text.UnicodeWordBreaker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class ArticleAssemblerTest {

    private static final Instant NOW = Instant.parse("2026-05-05T10:00:00Z");

    private final ArticleAssembler assembler = new ArticleAssembler(
            new TextSegmenter(List.of(new UnicodeWordBreaker(), new ChineseWordBreaker())),
            new LexicalIndexer(4),
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void assemblesEnglishArticle() {
        String content = "The cat sat. The CAT ran!";

        Article a = assembler.assemble(" Cats ", "  ", content, "en", List.of("pets", " pets ", ""), false, 9L);

        assertThat(String.join("", a.getWords())).isEqualTo(content);
        assertThat(a.getUniqueWords().keySet()).containsExactly("cat", "ran", "sat", "the");
        assertThat(a.getUniqueWords().values()).containsOnly(true);
        assertThat(a.getSentences()).hasSize(2);
        assertThat(a.getSentences().get(0).start()).isZero();
        assertThat(a.getSentences().get(1).end()).isEqualTo(a.getWords().size());
        assertThat(a.getPageData()).hasSize((a.getWords().size() + 3) / 4);
        assertThat(a.getContentLength()).isEqualTo(content.length());
        assertThat(a.getTitle()).isEqualTo("Cats");
        assertThat(a.getAuthor()).isNull();
        assertThat(a.getTags()).containsExactly("pets");
        assertThat(a.isSystem()).isTrue();
        assertThat(a.getUploaderId()).isEqualTo(9L);
        assertThat(a.getLang()).isEqualTo("en");
        assertThat(a.getCreatedOn()).isEqualTo(NOW);
        assertThat(a.getId()).isNull();
    }

    @Test
    void privateArticleIsNotSystem() {
        Article a = assembler.assemble("t", null, "Hi.", "en", null, true, 1L);

        assertThat(a.isSystem()).isFalse();
        assertThat(a.getTags()).isEmpty();
    }

    @Test
    void contentLengthCountsCodePoints() {
        String content = "我爱𠀀。";   // U+20000 ocupa dois chars

        Article a = assembler.assemble("t", null, content, "zh", null, false, 1L);

        assertThat(content.length()).isEqualTo(5);
        assertThat(a.getContentLength()).isEqualTo(4);
        assertThat(String.join("", a.getWords())).isEqualTo(content);
    }

    @Test
    void pagesPartitionTheWords() {
        String[] parts = new String[30];
        Arrays.fill(parts, "word");
        Article a = assembler.assemble("t", null, String.join(" ", parts), "en", null, false, 1L);

        List<TokenRange> pages = a.getPageData();
        assertThat(pages.get(0).start()).isZero();
        for (int i = 1; i < pages.size(); i++) {
            assertThat(pages.get(i).start()).isEqualTo(pages.get(i - 1).end());
        }
        assertThat(pages.get(pages.size() - 1).end()).isEqualTo(a.getWords().size());
        assertThat(a.getUniqueWords()).containsExactly(entry("word", true));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\t "})
    void emptyContentIsRejected(String content) {
        assertThatThrownBy(() -> assembler.assemble("t", null, content, "en", null, false, 1L))
                .isInstanceOf(EmptyContentException.class);
    }

    @Test
    void unsupportedLanguageFailsSegmentation() {
        assertThatThrownBy(() -> assembler.assemble("t", null, "Bonjour.", "fr", null, false, 1L))
                .isInstanceOf(SegmentationFailedException.class);
    }
}
