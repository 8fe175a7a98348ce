package com.dnobretech.leitorbackend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;

import java.time.Instant;
import java.util.List;

// 400 com a lista de campos rejeitados pelo @Valid
record ValidationError(int status, String error, List<FieldErr> errors, String path, Instant timestamp) {

    static ResponseEntity<ValidationError> respond(BindingResult result, HttpServletRequest req) {
        List<FieldErr> errs = result.getFieldErrors().stream()
                .map(fe -> new FieldErr(fe.getField(), fe.getDefaultMessage()))
                .toList();
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(
                new ValidationError(status.value(), status.getReasonPhrase(), errs, req.getRequestURI(), Instant.now())
        );
    }
}

record FieldErr(String field, String message) {}
