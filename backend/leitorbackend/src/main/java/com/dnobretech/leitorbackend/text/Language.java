package com.dnobretech.leitorbackend.text;

import com.dnobretech.leitorbackend.exception.UnsupportedLanguageException;

import java.util.Arrays;

/**
 * Idiomas suportados pelo leitor. O conjunto e fechado: um codigo desconhecido
 * nunca cai em uma estrategia padrao.
 */
public enum Language {
    EN("en"),   // separado por espacos
    ZH("zh");   // sem delimitador de palavras

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Language fromCode(String code) {
        if (code == null) throw new UnsupportedLanguageException(null);
        return Arrays.stream(values())
                .filter(l -> l.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new UnsupportedLanguageException(code));
    }
}
