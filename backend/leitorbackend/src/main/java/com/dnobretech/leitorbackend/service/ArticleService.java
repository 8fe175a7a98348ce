package com.dnobretech.leitorbackend.service;

import com.dnobretech.leitorbackend.auth.ClaimsUser;
import com.dnobretech.leitorbackend.domain.Article;
import com.dnobretech.leitorbackend.dto.GetArticlesResponse;
import com.dnobretech.leitorbackend.dto.NewArticleRequest;

public interface ArticleService {
    Article create(NewArticleRequest req, ClaimsUser uploader);
    GetArticlesResponse list(Integer limit, Integer offset, String lang, String search);
    GetArticlesResponse listByUser(Long userId, Integer limit, Integer offset, String lang, String search, ClaimsUser caller);
    Article getFull(Long id, ClaimsUser caller);
}
