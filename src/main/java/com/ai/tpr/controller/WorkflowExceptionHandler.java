package com.ai.tpr.controller;

import com.ai.tpr.exception.DatasetNotFoundException;
import com.ai.tpr.exception.MalformedIntentException;
import com.ai.tpr.exception.SessionConflictException;
import com.ai.tpr.exception.SessionNotFoundException;
import com.ai.tpr.exception.SessionStoreException;
import com.ai.tpr.exception.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps fatal workflow errors to HTTP statuses. Recoverable outcomes never reach here.
 */
@RestControllerAdvice
public class WorkflowExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExceptionHandler.class);

    @ExceptionHandler({SessionNotFoundException.class, DatasetNotFoundException.class})
    public ResponseEntity<Map<String, String>> notFound(WorkflowException e) {
        return body(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(SessionConflictException.class)
    public ResponseEntity<Map<String, String>> conflict(SessionConflictException e) {
        log.warn("Session conflict after retries: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(MalformedIntentException.class)
    public ResponseEntity<Map<String, String>> malformed(MalformedIntentException e) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(SessionStoreException.class)
    public ResponseEntity<Map<String, String>> storeFailure(SessionStoreException e) {
        log.error("Session store failure", e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, WorkflowException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("sessionId", e.getSessionId());
        body.put("message", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
