package com.toolport.errors;

/** Ordinary failure raised by a tool body. Not retryable. */
public class ToolExecutionException extends ToolRuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, String developerMessage) {
        super(message, developerMessage);
    }

    public ToolExecutionException(String message, String developerMessage, Throwable cause) {
        super(message, developerMessage, cause);
    }
}
