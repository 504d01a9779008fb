package com.imdsguard.api;

/** The role lookup could not be completed. */
public class RoleLookupException extends Exception {

    public RoleLookupException(String message) {
        super(message);
    }

    public RoleLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
