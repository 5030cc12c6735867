package com.toolport.actor;

/** Dispatch-level failure that maps directly onto a transport status. */
public class ActorException extends RuntimeException {

    private final int status;

    public ActorException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ActorException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
