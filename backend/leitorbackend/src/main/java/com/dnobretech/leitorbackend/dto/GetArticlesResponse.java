package com.dnobretech.leitorbackend.dto;

import java.util.List;

public record GetArticlesResponse(List<SimpleArticle> articles, long count) {

    public static GetArticlesResponse of(List<SimpleArticle> articles) {
        return new GetArticlesResponse(articles, articles.size());
    }
}
