package com.dnobretech.leitorbackend.text;

import java.util.List;

/**
 * Estrategia de quebra de palavras para um idioma.
 * Implementacoes devem ser sem perda: a concatenacao do resultado reproduz o texto.
 */
public interface WordBreaker {

    Language language();

    List<String> split(String text);
}
