package com.dnobretech.leitorbackend.repository;

import com.dnobretech.leitorbackend.domain.Article;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ArticleRepository extends JpaRepository<Article, Long>, ArticleRepositoryCustom {
}
