package com.dnobretech.leitorbackend.exception;

public class TokenInvalidException extends AuthenticationFailedException {

    public TokenInvalidException() {
        super("token_invalid");
    }

    public TokenInvalidException(Throwable cause) {
        super("token_invalid", cause);
    }
}
