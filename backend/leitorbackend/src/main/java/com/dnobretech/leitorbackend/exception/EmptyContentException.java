package com.dnobretech.leitorbackend.exception;

public class EmptyContentException extends RuntimeException {

    public EmptyContentException() {
        super("conteudo do artigo vazio");
    }
}
