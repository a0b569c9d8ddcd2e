package com.example.memo.api;

import com.example.memo.backend.BackendException;
import com.example.memo.core.ReentrantRecursionException;
import com.example.memo.core.SynchronousInvocationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class MemoExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(MemoExceptionHandler.class);

    @ExceptionHandler(ReentrantRecursionException.class)
    public ResponseEntity<Map<String, Object>> handleRecursion(ReentrantRecursionException ex) {
        return error(HttpStatus.CONFLICT, "reentrant_recursion", ex.getMessage());
    }

    @ExceptionHandler(BackendException.class)
    public ResponseEntity<Map<String, Object>> handleBackend(BackendException ex) {
        log.warn("Backend failure for key {}: {}", ex.getKey(), ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "backend_failed", ex.getMessage());
    }

    @ExceptionHandler(SynchronousInvocationException.class)
    public ResponseEntity<Map<String, Object>> handleInvocation(SynchronousInvocationException ex) {
        log.warn("Invocation failure for {}", ex.getFingerprint(), ex.getCause());
        return error(HttpStatus.BAD_GATEWAY, "invocation_failed", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof BackendException) {
            return handleBackend((BackendException) cause);
        }
        if (cause instanceof ReentrantRecursionException) {
            return handleRecursion((ReentrantRecursionException) cause);
        }
        log.error("Unexpected asynchronous failure", cause);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", String.valueOf(cause.getMessage()));
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("details", details);
        return new ResponseEntity<>(body, status);
    }
}
