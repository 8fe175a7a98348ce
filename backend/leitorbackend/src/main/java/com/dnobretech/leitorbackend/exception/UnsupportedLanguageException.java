package com.dnobretech.leitorbackend.exception;

public class UnsupportedLanguageException extends RuntimeException {

    private final String language;

    public UnsupportedLanguageException(String language) {
        super("idioma nao suportado: " + language);
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
