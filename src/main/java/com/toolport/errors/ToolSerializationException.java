package com.toolport.errors;

/** Failure at the wire/native boundary, in either direction. */
public class ToolSerializationException extends ToolRuntimeException {

    public ToolSerializationException(String message, String developerMessage) {
        super(message, developerMessage);
    }

    public ToolSerializationException(String message, String developerMessage, Throwable cause) {
        super(message, developerMessage, cause);
    }
}
