package com.dnobretech.leitorbackend.exception;

import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.springframework.http.HttpStatus.*;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // 401 - sem detalhes alem do codigo
    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ApiError> handleAuth(AuthenticationFailedException ex, HttpServletRequest req) {
        log.warn("[auth] {} em {}", ex.getCode(), req.getRequestURI());
        return ApiError.respond(UNAUTHORIZED, ex.getCode(), req);
    }

    // 404
    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(EntityNotFoundException ex, HttpServletRequest req) {
        return ApiError.respond(NOT_FOUND, ex.getMessage(), req);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNoRoute(NoResourceFoundException ex, HttpServletRequest req) {
        return ApiError.respond(NOT_FOUND, "rota inexistente", req);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethod(HttpRequestMethodNotSupportedException ex, HttpServletRequest req) {
        return ApiError.respond(METHOD_NOT_ALLOWED, ex.getMessage(), req);
    }

    // 400 - parametros de query ausentes ou com tipo errado
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadParam(Exception ex, HttpServletRequest req) {
        return ApiError.respond(BAD_REQUEST, ex.getMessage(), req);
    }

    // 400 - idioma fora do conjunto suportado
    @ExceptionHandler(UnsupportedLanguageException.class)
    public ResponseEntity<ApiError> handleUnsupportedLanguage(UnsupportedLanguageException ex, HttpServletRequest req) {
        return ApiError.respond(BAD_REQUEST, ex.getMessage(), req);
    }

    // 400 - artigo sem conteudo
    @ExceptionHandler(EmptyContentException.class)
    public ResponseEntity<ApiError> handleEmptyContent(EmptyContentException ex, HttpServletRequest req) {
        return ApiError.respond(BAD_REQUEST, ex.getMessage(), req);
    }

    // 422 - o texto nao pode ser segmentado
    @ExceptionHandler(SegmentationFailedException.class)
    public ResponseEntity<ApiError> handleSegmentation(SegmentationFailedException ex, HttpServletRequest req) {
        log.info("[article] segmentacao recusada: {}", ex.getMessage());
        return ApiError.respond(UNPROCESSABLE_ENTITY, ex.getMessage(), req);
    }

    // 400 - argumentos inválidos em geral
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return ApiError.respond(BAD_REQUEST, ex.getMessage(), req);
    }

    // 400 - corpo ilegivel (json quebrado, status de palavra desconhecido...)
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return ApiError.respond(BAD_REQUEST, "corpo da requisicao invalido", req);
    }

    // 400 - validação do corpo com @Valid (@RequestBody)
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationError> handleBodyValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        return ValidationError.respond(ex.getBindingResult(), req);
    }

    // 400 - validação de params/query/path e binding de objetos simples
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ValidationError> handleBindValidation(BindException ex, HttpServletRequest req) {
        return ValidationError.respond(ex.getBindingResult(), req);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest req) {
        return ApiError.respond(BAD_REQUEST, ex.getMessage(), req);
    }

    // 400 - integridade do banco (UNIQUE etc.); a causa nao vai para o cliente
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleIntegrity(DataIntegrityViolationException ex, HttpServletRequest req) {
        log.debug("violacao de integridade", ex);
        return ApiError.respond(BAD_REQUEST, "violacao de integridade", req);
    }

    // 503 - banco indisponivel; so distingue "nao encontrado" de "indisponivel"
    @ExceptionHandler({
            DataAccessResourceFailureException.class,
            TransientDataAccessException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<ApiError> handleStoreUnavailable(Exception ex, HttpServletRequest req) {
        log.error("armazenamento indisponivel em {}", req.getRequestURI(), ex);
        return ApiError.respond(SERVICE_UNAVAILABLE, "store_unavailable", req);
    }

    // 500 - fallback único
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Erro não tratado", ex);
        return ApiError.respond(INTERNAL_SERVER_ERROR, "erro interno", req);
    }
}
