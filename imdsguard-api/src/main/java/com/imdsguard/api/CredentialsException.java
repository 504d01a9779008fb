package com.imdsguard.api;

/**
 * Credential issuance failed. The status and message are returned to the workload as-is, so the message must
 * not contain anything the workload should not see.
 */
public class CredentialsException extends Exception {

    public static final int DEFAULT_STATUS = 500;

    private final int status;

    public CredentialsException(String message) {
        this(DEFAULT_STATUS, message, null);
    }

    public CredentialsException(int status, String message) {
        this(status, message, null);
    }

    public CredentialsException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
