// src/main/java/com/dnobretech/leitorbackend/service/ArticleAssembler.java
package com.dnobretech.leitorbackend.service;

import com.dnobretech.leitorbackend.domain.Article;
import com.dnobretech.leitorbackend.exception.EmptyContentException;
import com.dnobretech.leitorbackend.exception.SegmentationFailedException;
import com.dnobretech.leitorbackend.exception.UnsupportedLanguageException;
import com.dnobretech.leitorbackend.text.LexicalIndex;
import com.dnobretech.leitorbackend.text.LexicalIndexer;
import com.dnobretech.leitorbackend.text.TextSegmenter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monta o {@link Article} a partir de um envio: segmenta, indexa e calcula o tamanho.
 * Nao persiste nada.
 */
@Component
@RequiredArgsConstructor
public class ArticleAssembler {

    private final TextSegmenter segmenter;
    private final LexicalIndexer indexer;
    private final Clock clock;

    public Article assemble(String title,
                            String author,
                            String content,
                            String language,
                            List<String> tags,
                            boolean isPrivate,
                            Long uploaderId) {
        // politica: artigo vazio falha antes de segmentar
        if (content == null || content.isBlank()) throw new EmptyContentException();

        List<String> words;
        try {
            words = segmenter.segment(content, language);
        } catch (UnsupportedLanguageException e) {
            throw new SegmentationFailedException(language, e);
        }
        LexicalIndex index = indexer.index(words);

        return Article.builder()
                .title(title.trim())
                .author(trimOrNull(author))
                .content(content)
                .contentLength(content.codePointCount(0, content.length()))
                .words(words)
                .sentences(index.sentences())
                .uniqueWords(presence(index.uniqueWords()))
                .pageData(index.pages())
                .createdOn(Instant.now(clock))
                .system(!isPrivate)
                .uploaderId(uploaderId)
                .lang(language)
                .tags(cleanTags(tags))
                .build();
    }

    // mantem a ordem alfabetica do indexador
    private static Map<String, Boolean> presence(Collection<String> words) {
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (String w : words) out.put(w, Boolean.TRUE);
        return out;
    }

    private static List<String> cleanTags(List<String> tags) {
        if (tags == null) return new ArrayList<>();
        List<String> out = new ArrayList<>();
        for (String t : tags) {
            String v = trimOrNull(t);
            if (v != null && !out.contains(v)) out.add(v);
        }
        return out;
    }

    private static String trimOrNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
