package com.dnobretech.leitorbackend.exception;

public class TokenExpiredException extends AuthenticationFailedException {

    public TokenExpiredException() {
        super("token_expired");
    }
}
