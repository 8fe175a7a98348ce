package com.dnobretech.leitorbackend.exception;

public class RefreshMismatchException extends AuthenticationFailedException {

    public RefreshMismatchException() {
        super("refresh_mismatch");
    }
}
