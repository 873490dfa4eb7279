package com.example.dbconsole.controller;

import com.example.dbconsole.model.QueryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = QueryController.class)
public class ApiExceptionHandler {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ApiExceptionHandler.class);

    public static final String MALFORMED_BODY_MESSAGE = "Malformed request body";

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<QueryResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.info("API REJECTED: unreadable body, reason: {}", e.getMessage());
        return ResponseEntity.badRequest().body(QueryResponse.error(MALFORMED_BODY_MESSAGE));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<QueryResponse> handleMediaType(HttpMediaTypeNotSupportedException e) {
        log.info("API REJECTED: unsupported content type {}", e.getContentType());
        return ResponseEntity.status(415).body(QueryResponse.error("Content type must be application/json"));
    }
}
