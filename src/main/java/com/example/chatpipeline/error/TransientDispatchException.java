package com.example.chatpipeline.error;

/**
 * A consumer-side failure worth retrying: a timeout or a failing downstream collaborator.
 */
public class TransientDispatchException extends ChatPipelineException {

    public TransientDispatchException(String message) {
        super("TRANSIENT_DISPATCH", message);
    }

    public TransientDispatchException(String message, Throwable cause) {
        super("TRANSIENT_DISPATCH", message, cause);
    }
}
