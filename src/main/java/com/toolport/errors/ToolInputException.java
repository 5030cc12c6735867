package com.toolport.errors;

public class ToolInputException extends ToolSerializationException {

    public ToolInputException(String message) {
        super(message, null);
    }

    public ToolInputException(String message, String developerMessage) {
        super(message, developerMessage);
    }

    public ToolInputException(String message, String developerMessage, Throwable cause) {
        super(message, developerMessage, cause);
    }
}
