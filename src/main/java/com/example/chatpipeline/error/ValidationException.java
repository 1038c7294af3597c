package com.example.chatpipeline.error;

import java.util.List;

/**
 * Malformed input to append or query. Rejected before reaching the store and never retried.
 */
public class ValidationException extends ChatPipelineException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super("VALIDATION_FAILED", "Request validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
