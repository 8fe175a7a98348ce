package com.dnobretech.leitorbackend.dto;

import com.dnobretech.leitorbackend.domain.Article;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Projecao para listagens: sem conteudo, tokens, frases, palavras, paginas nem uploader. */
public record SimpleArticle(
        Long id,
        String title,
        String author,
        Integer contentLength,
        Instant createdOn,
        @JsonProperty("is_system") boolean isSystem,
        String lang,
        List<String> tags
) {

    public static SimpleArticle from(Article a) {
        return new SimpleArticle(
                a.getId(), a.getTitle(), a.getAuthor(), a.getContentLength(),
                a.getCreatedOn(), a.isSystem(), a.getLang(), a.getTags()
        );
    }
}
