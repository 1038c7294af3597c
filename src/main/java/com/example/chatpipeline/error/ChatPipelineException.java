package com.example.chatpipeline.error;

/**
 * Root of the pipeline's unchecked exception taxonomy.
 */
public class ChatPipelineException extends RuntimeException {

    private final String code;

    public ChatPipelineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ChatPipelineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
