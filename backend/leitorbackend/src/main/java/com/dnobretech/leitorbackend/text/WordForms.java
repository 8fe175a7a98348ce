package com.dnobretech.leitorbackend.text;

import java.util.Locale;

/** Regras de forma de palavra compartilhadas entre o indexador e o vocabulario do usuario. */
public final class WordForms {

    // pontuacao que encerra frase
    private static final String SENTENCE_FINAL = ".!?。！？…‼⁇⁈⁉｡";

    private WordForms() {
    }

    /** Minusculas independentes de locale. */
    public static String fold(String word) {
        return word.toLowerCase(Locale.ROOT);
    }

    /** Um token e palavra se tem ao menos uma letra ou digito. */
    public static boolean isWord(String token) {
        return token.codePoints().anyMatch(Character::isLetterOrDigit);
    }

    public static boolean isSentenceFinal(String token) {
        return !token.isEmpty() && token.codePoints().allMatch(cp -> SENTENCE_FINAL.indexOf(cp) >= 0);
    }
}
