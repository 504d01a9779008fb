package com.imdsguard.server.guard;

/** Status classes used to tag response metrics. */
public enum StatusBucket {
    SUCCESS("2xx"),
    REDIRECTION("3xx"),
    CLIENT_ERROR("4xx"),
    SERVER_ERROR("5xx"),
    UNKNOWN("unknown");

    private final String label;

    StatusBucket(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Anything outside 200-599, informational responses included, is {@link #UNKNOWN}. */
    public static StatusBucket of(int status) {
        if (status >= 200 && status < 300) return SUCCESS;
        if (status >= 300 && status < 400) return REDIRECTION;
        if (status >= 400 && status < 500) return CLIENT_ERROR;
        if (status >= 500 && status < 600) return SERVER_ERROR;
        return UNKNOWN;
    }
}
