package com.paxkun.binder.controller;

import com.paxkun.binder.service.LoggerService;
import com.paxkun.binder.service.merge.exception.MergeException;
import com.paxkun.binder.service.merge.exception.NoFormatsSelectedException;
import com.paxkun.binder.service.merge.exception.OperationInProgressException;
import com.paxkun.binder.service.merge.exception.PathRejectedException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps request problems to HTTP status codes: bad input 400, a busy worker 409.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class MergeExceptionHandler {

    private final LoggerService logger;

    @ExceptionHandler(OperationInProgressException.class)
    public ResponseEntity<Map<String, String>> handleBusy(OperationInProgressException e) {
        logger.warn("MERGE_CONTROLLER", "⚠️ Rejected request: " + e.getMessage());
        return body(HttpStatus.CONFLICT, e.getFailure().name(), e.getMessage());
    }

    @ExceptionHandler({NoFormatsSelectedException.class, PathRejectedException.class})
    public ResponseEntity<Map<String, String>> handleInvalidMergeInput(MergeException e) {
        logger.warn("MERGE_CONTROLLER", "⚠️ Invalid request: " + e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getFailure().name(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        logger.warn("MERGE_CONTROLLER", "⚠️ Invalid request: " + e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(MergeException.class)
    public ResponseEntity<Map<String, String>> handleMergeFailure(MergeException e) {
        logger.error("MERGE_CONTROLLER", "❌ Request failed", e);
        return body(HttpStatus.UNPROCESSABLE_ENTITY, e.getFailure().name(), e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String failure, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("failure", failure);
        body.put("message", message != null ? message : "");
        return ResponseEntity.status(status).body(body);
    }
}
