package com.dnobretech.leitorbackend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

/**
 * Corpo padrao de erro. Para falhas de autenticacao {@code message} e so o codigo
 * opaco ({@code token_expired}, {@code refresh_mismatch}...).
 */
public record ApiError(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp
) {

    static ResponseEntity<ApiError> respond(HttpStatus status, String message, HttpServletRequest req) {
        return ResponseEntity.status(status).body(
                new ApiError(status.value(), status.getReasonPhrase(), message, req.getRequestURI(), Instant.now())
        );
    }
}
