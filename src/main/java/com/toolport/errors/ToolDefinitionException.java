package com.toolport.errors;

/**
 * Raised while a tool is being registered, when its signature or metadata
 * cannot be described on the wire. Never raised at invocation time.
 */
public class ToolDefinitionException extends RuntimeException {

    public ToolDefinitionException(String message) {
        super(message);
    }

    public ToolDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
