package com.kuruswap.api.controller;

import com.kuruswap.api.dto.ErrorBody;
import com.kuruswap.common.ErrorKind;
import com.kuruswap.common.KuruSwapException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps domain errors to HTTP status with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(KuruSwapException.class)
    public ResponseEntity<ErrorBody> handleDomain(KuruSwapException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("{}: {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getKind().name(), ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse(ErrorKind.VALIDATION_ERROR.name());
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " is invalid")
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ErrorKind.VALIDATION_ERROR.name(), "Malformed request"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorBody> handleStorage(DataAccessException ex) {
        log.error("Storage failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of("STORAGE_ERROR", "Storage unavailable"));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NETWORK_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case QUOTE_UNAVAILABLE, SUBMISSION_ERROR -> HttpStatus.BAD_GATEWAY;
            case INSUFFICIENT_BALANCE -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
