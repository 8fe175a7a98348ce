// src/main/java/com/dnobretech/leitorbackend/repository/ArticleRepositoryImpl.java
package com.dnobretech.leitorbackend.repository;

import com.dnobretech.leitorbackend.domain.Article;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// fragmento do ArticleRepository: limit/offset livres e filtros opcionais
class ArticleRepositoryImpl implements ArticleRepositoryCustom {

    @PersistenceContext
    private EntityManager em;

    @Override
    public List<Article> search(ArticleFilter f) {
        List<String> where = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (!f.includePrivate()) where.add("a.system = true");
        if (f.uploaderId() != null) {
            where.add("a.uploaderId = :uploader");
            params.put("uploader", f.uploaderId());
        }
        if (f.lang() != null && !f.lang().isBlank()) {
            where.add("a.lang = :lang");
            params.put("lang", f.lang().trim());
        }
        if (f.search() != null && !f.search().isBlank()) {
            where.add("(lower(a.title) like :q or lower(a.author) like :q)");
            params.put("q", "%" + f.search().trim().toLowerCase(Locale.ROOT) + "%");
        }

        String jpql = "select a from Article a"
                + (where.isEmpty() ? "" : " where " + String.join(" and ", where))
                + " order by a.createdOn desc, a.id desc";

        TypedQuery<Article> q = em.createQuery(jpql, Article.class);
        params.forEach(q::setParameter);
        return q.setFirstResult(f.offset())
                .setMaxResults(f.limit())
                .getResultList();
    }
}
