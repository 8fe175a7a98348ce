package com.dnobretech.leitorbackend.repository;

/**
 * Filtro de listagem de artigos.
 *
 * @param uploaderId      null = qualquer autor
 * @param includePrivate  false = so artigos do sistema
 */
public record ArticleFilter(
        Long uploaderId,
        boolean includePrivate,
        String lang,
        String search,
        int limit,
        int offset
) {}
