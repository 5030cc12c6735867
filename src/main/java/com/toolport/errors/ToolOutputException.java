package com.toolport.errors;

/** The tool returned something its declared output type cannot carry. */
public class ToolOutputException extends ToolSerializationException {

    public ToolOutputException(String message, String developerMessage) {
        super(message, developerMessage);
    }

    public ToolOutputException(String message, String developerMessage, Throwable cause) {
        super(message, developerMessage, cause);
    }
}
