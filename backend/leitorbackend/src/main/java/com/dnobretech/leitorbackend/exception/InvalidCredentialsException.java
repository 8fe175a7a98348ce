package com.dnobretech.leitorbackend.exception;

public class InvalidCredentialsException extends AuthenticationFailedException {

    public InvalidCredentialsException() {
        super("invalid_credentials");
    }
}
