package com.imdsguard.server.web;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Last line for failures that escape a controller. Guarded handlers never get here; their errors are written by
 * the guard. The client sees a fixed message, the detail stays in the log.
 */
@RestControllerAdvice
public class ProxyErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ProxyErrorHandler.class);

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<String> handleUnexpected(RuntimeException ex, HttpServletRequest request) {
        log.error(
                "Unhandled error: method={}, path={}",
                request != null ? request.getMethod() : "<unknown>",
                request != null ? request.getRequestURI() : "<unknown>",
                ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.TEXT_PLAIN)
                .body("internal error\n");
    }
}
