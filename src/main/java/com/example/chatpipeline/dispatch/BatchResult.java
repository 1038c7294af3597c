package com.example.chatpipeline.dispatch;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one consumer invocation. Only {@link Status#FAILED} is retried by the dispatcher.
 */
public class BatchResult {

    public enum Status { SUCCESS, PARTIAL, FAILED }

    private final Status status;
    private final int handled;
    private final int skipped;
    private final List<String> failures;
    private final String message;
    private final Throwable cause;
    private final Instant timestamp;

    private BatchResult(Status status, int handled, int skipped, List<String> failures, String message, Throwable cause) {
        this.status = status;
        this.handled = handled;
        this.skipped = skipped;
        this.failures = List.copyOf(failures);
        this.message = message;
        this.cause = cause;
        this.timestamp = Instant.now();
    }

    public static BatchResult success(int handled, int skipped) {
        return new BatchResult(Status.SUCCESS, handled, skipped, List.of(), null, null);
    }

    /**
     * Batch handled, but some targets could not be served. Committed like a success.
     */
    public static BatchResult partial(int handled, int skipped, List<String> failures) {
        return new BatchResult(Status.PARTIAL, handled, skipped, failures,
                failures.size() + " targets failed", null);
    }

    public static BatchResult failed(String message, Throwable cause) {
        return new BatchResult(Status.FAILED, 0, 0, List.of(), message, cause);
    }

    public static BatchResult failed(String message) {
        return failed(message, null);
    }

    public boolean isFailed() { return status == Status.FAILED; }
    public Status getStatus() { return status; }
    public int getHandled() { return handled; }
    public int getSkipped() { return skipped; }
    public List<String> getFailures() { return failures; }
    public String getMessage() { return message; }
    public Throwable getCause() { return cause; }
    public Instant getTimestamp() { return timestamp; }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new HashMap<>();
        result.put("status", status.name());
        result.put("handled", handled);
        result.put("skipped", skipped);
        result.put("failures", failures);
        result.put("timestamp", timestamp);
        if (message != null) {
            result.put("message", message);
        }
        return result;
    }
}
