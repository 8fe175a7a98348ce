package com.dnobretech.leitorbackend.service.impl;

import com.dnobretech.leitorbackend.auth.ClaimsUser;
import com.dnobretech.leitorbackend.domain.Article;
import com.dnobretech.leitorbackend.dto.GetArticlesResponse;
import com.dnobretech.leitorbackend.dto.NewArticleRequest;
import com.dnobretech.leitorbackend.dto.SimpleArticle;
import com.dnobretech.leitorbackend.repository.ArticleFilter;
import com.dnobretech.leitorbackend.repository.ArticleRepository;
import com.dnobretech.leitorbackend.service.ArticleAssembler;
import com.dnobretech.leitorbackend.service.ArticleService;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleServiceImpl implements ArticleService {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final ArticleRepository repo;
    private final ArticleAssembler assembler;

    @Override
    @Transactional
    public Article create(NewArticleRequest req, ClaimsUser uploader) {
        Article a = assembler.assemble(
                req.title(), req.author(), req.content(), req.language(),
                req.tags(), req.isPrivate(), uploader.id());
        a = repo.save(a);
        log.info("[article] id={} lang={} tokens={} pages={} uploader={}",
                a.getId(), a.getLang(), a.getWords().size(), a.getPageData().size(), uploader.id());
        return a;
    }

    @Override
    @Transactional(readOnly = true)
    public GetArticlesResponse list(Integer limit, Integer offset, String lang, String search) {
        var filter = new ArticleFilter(null, false, lang, search, limit(limit), offset(offset));
        return GetArticlesResponse.of(repo.search(filter).stream().map(SimpleArticle::from).toList());
    }

    @Override
    @Transactional(readOnly = true)
    public GetArticlesResponse listByUser(Long userId, Integer limit, Integer offset, String lang, String search,
                                          ClaimsUser caller) {
        Long uploader = userId != null ? userId : caller.id();
        boolean own = Objects.equals(uploader, caller.id());   // privados so para o dono
        var filter = new ArticleFilter(uploader, own, lang, search, limit(limit), offset(offset));
        return GetArticlesResponse.of(repo.search(filter).stream().map(SimpleArticle::from).toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Article getFull(Long id, ClaimsUser caller) {
        // artigo privado de outro usuario responde igual a inexistente
        return repo.findById(id)
                .filter(a -> a.isSystem() || Objects.equals(a.getUploaderId(), caller.id()))
                .orElseThrow(() -> new EntityNotFoundException("article id=" + id + " não encontrado"));
    }

    // -------- helpers ----------
    private static int limit(Integer limit) {
        if (limit == null || limit < 1) return DEFAULT_LIMIT;
        return Math.min(limit, MAX_LIMIT);
    }

    private static int offset(Integer offset) {
        return (offset == null || offset < 0) ? 0 : offset;
    }
}
