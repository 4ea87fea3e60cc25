package com.crosslend.vault.web;

import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps lending failures to HTTP responses by error category.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(LendingException.class)
    public ResponseEntity<ErrorResponse> lending(LendingException e) {
        HttpStatus status = statusFor(e.code());
        if (status.is5xxServerError()) {
            log.warn("request failed code={} message={}", e.code(), e.getMessage());
        } else {
            log.debug("request rejected code={} message={}", e.code(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.code().errorName(), e.category().name(), e.getMessage()));
    }

    static HttpStatus statusFor(ErrorCode code) {
        if (code == ErrorCode.UNAUTHORIZED) {
            return HttpStatus.FORBIDDEN;
        }
        if (code == ErrorCode.UNKNOWN_REQUEST) {
            return HttpStatus.NOT_FOUND;
        }
        return switch (code.category()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case STATE -> HttpStatus.CONFLICT;
            case LIQUIDITY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EXTERNAL -> HttpStatus.BAD_GATEWAY;
            case ASYNC -> HttpStatus.CONFLICT;
        };
    }

    public record ErrorResponse(String error, String category, String message) {
    }
}
