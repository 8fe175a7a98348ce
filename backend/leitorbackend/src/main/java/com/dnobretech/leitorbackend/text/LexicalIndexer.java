// src/main/java/com/dnobretech/leitorbackend/text/LexicalIndexer.java
package com.dnobretech.leitorbackend.text;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Indexador lexico: frases, palavras unicas e paginas sobre a sequencia de tokens.
 * <p>
 * Frases e paginas particionam os tokens sem lacunas nem sobreposicao.
 * Entrada vazia gera zero frases, nenhuma palavra e zero paginas.
 */
@Component
public class LexicalIndexer {

    private final int pageSize;

    public LexicalIndexer(@Value("${leitor.article.page-size:250}") int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("leitor.article.page-size deve ser >= 1: " + pageSize);
        }
        this.pageSize = pageSize;
    }

    public int pageSize() {
        return pageSize;
    }

    public LexicalIndex index(List<String> tokens) {
        return new LexicalIndex(sentences(tokens), uniqueWords(tokens), pages(tokens.size()));
    }

    /**
     * Depois de uma pontuacao final a frase continua aberta para absorver espacos,
     * aspas de fechamento e outras pontuacoes; ela fecha antes da proxima palavra.
     * Uma cauda sem pontuacao final tambem vira frase.
     */
    public List<TokenRange> sentences(List<String> tokens) {
        List<TokenRange> out = new ArrayList<>();
        int start = 0;
        boolean terminated = false;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (terminated && WordForms.isWord(token)) {
                out.add(new TokenRange(start, i));
                start = i;
                terminated = false;
            }
            if (WordForms.isSentenceFinal(token)) terminated = true;
        }
        if (start < tokens.size()) out.add(new TokenRange(start, tokens.size()));
        return Collections.unmodifiableList(out);
    }

    /** Presenca, nao frequencia. Pontuacao e espacos ficam de fora. */
    public SortedSet<String> uniqueWords(List<String> tokens) {
        SortedSet<String> words = new TreeSet<>();
        for (String token : tokens) {
            if (WordForms.isWord(token)) words.add(WordForms.fold(token));
        }
        return Collections.unmodifiableSortedSet(words);
    }

    public List<TokenRange> pages(int tokenCount) {
        List<TokenRange> out = new ArrayList<>((tokenCount + pageSize - 1) / pageSize);
        for (int start = 0; start < tokenCount; start += pageSize) {
            out.add(new TokenRange(start, Math.min(start + pageSize, tokenCount)));
        }
        return Collections.unmodifiableList(out);
    }
}
