package com.prediction.market.exchange.web;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.prediction.market.exchange.error.ErrorKind;
import com.prediction.market.exchange.error.ExchangeException;
import com.prediction.market.exchange.error.InsufficientFundsException;
import com.prediction.market.exchange.error.InvalidArgumentException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps exchange failures to HTTP statuses. Caller mistakes are 4xx and
 * logged at warn; a broken invariant is a 500 and logged at error.
 */
@Slf4j
@RestControllerAdvice
public class ExchangeExceptionHandler {

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handle(InsufficientFundsException e) {
        log.warn("insufficient funds: accountId={} required={} available={}",
            e.getAccountId(), e.getRequired(), e.getAvailable());
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .status(status.value())
            .error(e.getKind().name())
            .message(e.getMessage())
            .required(e.getRequired())
            .available(e.getAvailable())
            .build());
    }

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<ErrorResponse> handle(InvalidArgumentException e) {
        log.warn("rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getKind().name(), e.getMessage(), e.getErrors());
    }

    @ExceptionHandler(ExchangeException.class)
    public ResponseEntity<ErrorResponse> handle(ExchangeException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.error("invariant violated: {}", e.getMessage(), e);
        } else {
            log.warn("rejected request: kind={} message={}", e.getKind(), e.getMessage());
        }
        return body(status, e.getKind().name(), e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handle(MethodArgumentNotValidException e) {
        List<String> errors = e.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .collect(Collectors.toList());
        log.warn("invalid request body: {}", errors);
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT.name(), "Validation failed", errors);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MissingRequestHeaderException.class })
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("unreadable request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT.name(), e.getMessage(), null);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE -> HttpStatus.CONFLICT;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case INSUFFICIENT_FUNDS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVARIANT_VIOLATION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String message,
            List<String> errors) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .errors(errors)
            .build());
    }
}
