package com.lognog.query.web;

import com.lognog.query.CompileError;
import com.lognog.query.CompileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps compiler failures to HTTP responses.
 *
 * A rejected query is the caller's mistake and gets a 400 with the
 * structured {@link CompileError}; anything else is a 500 whose details stay
 * in the log.
 */
@RestControllerAdvice(assignableTypes = DslController.class)
public class DslExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(DslExceptionHandler.class);

    @ExceptionHandler(CompileException.class)
    public ResponseEntity<CompileError> handleCompileException(CompileException e) {
        log.debug("Query rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.toError());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        log.debug("Malformed DSL request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "Invalid request: " + e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        log.error("Unexpected error in DSL endpoint", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "Internal error while compiling the query"));
    }
}
