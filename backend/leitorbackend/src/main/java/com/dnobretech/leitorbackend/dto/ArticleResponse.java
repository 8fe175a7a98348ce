package com.dnobretech.leitorbackend.dto;

import com.dnobretech.leitorbackend.domain.Article;

public record ArticleResponse(Article article) {}
