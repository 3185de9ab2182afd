package com.genai.anomaly.controller;

import com.genai.anomaly.exception.ReplayAbortedException;
import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.exception.UnknownAlgorithmVersionException;
import com.genai.anomaly.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, UnknownAlgorithmVersionException.class})
    public ResponseEntity<ErrorResponse> handleInvalidArgument(RuntimeException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(StoreException ex) {
        log.error("Anomaly store failure: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(ReplayAbortedException.class)
    public ResponseEntity<ErrorResponse> handleReplayAborted(ReplayAbortedException ex) {
        log.warn("Replay aborted: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "REPLAY_ABORTED", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }
}
