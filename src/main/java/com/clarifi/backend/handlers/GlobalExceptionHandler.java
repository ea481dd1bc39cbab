package com.clarifi.backend.handlers;

import com.clarifi.backend.dto.ApiResponse;
import com.clarifi.backend.exceptions.BadRequestException;
import com.clarifi.backend.exceptions.DataUnavailableException;
import com.clarifi.backend.exceptions.InvalidPeriodException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.List;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private <T> ResponseEntity<ApiResponse<T>> buildResponse(
            HttpStatus status,
            String message,
            List<String> errors
    ) {
        ApiResponse<T> body = ApiResponse.<T>builder()
                .success(false)
                .message(message)
                .timestamp(LocalDateTime.now())
                .errors(errors)
                .build();

        return ResponseEntity.status(status).body(body);
    }

    // 400 - unknown period selector
    @ExceptionHandler(InvalidPeriodException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidPeriod(InvalidPeriodException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid period", List.of(ex.getMessage()));
    }

    // 400 - invalid request
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(BadRequestException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400 - e.g. months=abc
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String error = ex.getName() + ": invalid value '" + ex.getValue() + "'";
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid request", List.of(error));
    }

    // 503 - storage unavailable or fetch timed out; the whole dashboard fails
    @ExceptionHandler(DataUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataUnavailable(DataUnavailableException ex) {
        log.error("[GlobalExceptionHandler] data unavailable: {}", ex.getMessage(), ex);
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "Dashboard data is temporarily unavailable",
                List.of(ex.getMessage()));
    }

    // 500 - unexpected
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("[GlobalExceptionHandler] unexpected error", ex);
        return buildResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal server error",
                List.of("Unexpected error")
        );
    }
}
