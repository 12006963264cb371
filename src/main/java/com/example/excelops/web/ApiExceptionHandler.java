package com.example.excelops.web;

import com.example.excelops.service.ErrorKind;
import com.example.excelops.service.SheetOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;

/**
 * Turns operation failures into {@link ApiError} responses. Input problems are answered with a
 * 4xx status; environment failures, a missing workbook included, with 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SheetOperationException.class)
    public ResponseEntity<ApiError> handleOperation(SheetOperationException e) {
        log.debug("Rejected request: {} {}", e.kind(), e.getMessage());
        return ResponseEntity.status(statusFor(e.kind())).body(new ApiError(e.kind().name(), e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(new ApiError(ErrorKind.INVALID_ARGUMENT.name(), e.getMessage()));
    }

    @ExceptionHandler({UncheckedIOException.class, IllegalStateException.class})
    public ResponseEntity<ApiError> handleEnvironment(RuntimeException e) {
        log.error("Operation failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("ENVIRONMENT", e.getMessage()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        if (kind.isNotFound()) {
            return HttpStatus.NOT_FOUND;
        }
        return kind.isConflict() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
    }
}
