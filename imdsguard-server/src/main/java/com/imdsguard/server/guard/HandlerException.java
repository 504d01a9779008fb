package com.imdsguard.server.guard;

/**
 * A guarded handler failed. Carries the HTTP status and the message the caller sees; {@link #getMessage()} is
 * the server-side detail and is only logged.
 */
public class HandlerException extends Exception {

    private final int status;
    private final String clientMessage;

    public HandlerException(int status, String clientMessage, String detail) {
        this(status, clientMessage, detail, null);
    }

    public HandlerException(int status, String clientMessage, String detail, Throwable cause) {
        super(detail, cause);
        this.status = status;
        this.clientMessage = clientMessage;
    }

    public int status() {
        return status;
    }

    public String clientMessage() {
        return clientMessage;
    }
}
