package com.dnobretech.leitorbackend.exception;

/**
 * Falhas de autenticacao. A mensagem e so um codigo opaco: nunca carrega claims,
 * tokens ou a informacao de que um usuario existe.
 */
public abstract class AuthenticationFailedException extends RuntimeException {

    protected AuthenticationFailedException(String code) {
        super(code);
    }

    protected AuthenticationFailedException(String code, Throwable cause) {
        super(code, cause);
    }

    public String getCode() {
        return getMessage();
    }
}
