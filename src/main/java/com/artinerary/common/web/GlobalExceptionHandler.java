package com.artinerary.common.web;

import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Translates exceptions into the {@link Result} envelope.
 *
 * <p>The HTTP status is still set (400/403/404/409/500), but the body shape is always the same.</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Expected business failures raised by the engagement services.
     */
    @ExceptionHandler(EngagementException.class)
    public ResponseEntity<Result<Void>> handleEngagement(EngagementException e) {
        EngagementError error = e.getError();
        return ResponseEntity.status(error.httpStatus())
                .body(Result.fail(error.apiCode(), error.getKey()));
    }

    /**
     * Bean validation ({@code @Valid}) on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        // first error is enough for the client
        String msg = e.getBindingResult().getAllErrors().isEmpty()
                ? "invalid_request"
                : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "bad_request" : e.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Result<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Result.fail(ApiCodes.NOT_FOUND, "not_found"));
    }

    /**
     * Fallback: unexpected storage or programming errors.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
