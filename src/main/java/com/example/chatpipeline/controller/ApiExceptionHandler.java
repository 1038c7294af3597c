package com.example.chatpipeline.controller;

import com.example.chatpipeline.error.ChatPipelineException;
import com.example.chatpipeline.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(ValidationException e) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, e.getCode(), e.getMessage(), e.getErrors());
    }

    @ExceptionHandler(ChatPipelineException.class)
    public ResponseEntity<Map<String, Object>> pipeline(ChatPipelineException e) {
        logger.warn("Request failed with {}: {}", e.getCode(), e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getCode(), e.getMessage(), List.of());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> storage(DataAccessException e) {
        logger.error("Storage unavailable", e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE", e.getMessage(), List.of());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message,
                                                            List<String> errors) {
        Map<String, Object> error = new HashMap<>();
        error.put("code", code);
        error.put("message", message);
        Map<String, Object> body = new HashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("errors", errors);
        return ResponseEntity.status(status).body(body);
    }
}
