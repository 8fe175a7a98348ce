package com.dnobretech.leitorbackend.repository;

import com.dnobretech.leitorbackend.domain.Article;

import java.util.List;

public interface ArticleRepositoryCustom {
    List<Article> search(ArticleFilter filter);
}
