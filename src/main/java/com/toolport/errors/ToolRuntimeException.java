package com.toolport.errors;

/**
 * Base of every error a tool invocation can end with. The message is shown to
 * the model; the developer message is for whoever operates the tool.
 */
public class ToolRuntimeException extends RuntimeException {

    private final String developerMessage;

    public ToolRuntimeException(String message) {
        this(message, null, null);
    }

    public ToolRuntimeException(String message, String developerMessage) {
        this(message, developerMessage, null);
    }

    public ToolRuntimeException(String message, String developerMessage, Throwable cause) {
        super(message, cause);
        this.developerMessage = developerMessage;
    }

    public String developerMessage() {
        return developerMessage;
    }

    public boolean canRetry() {
        return false;
    }
}
