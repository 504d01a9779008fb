package com.imdsguard.server.guard;

import java.nio.charset.StandardCharsets;

/** Successful outcome of a guarded handler. The guard writes it to the response. */
public record HandlerResult(int status, String contentType, byte[] body) {

    public static final String TEXT_PLAIN = "text/plain;charset=UTF-8";
    public static final String APPLICATION_JSON = "application/json";

    public static HandlerResult text(String body) {
        return new HandlerResult(200, TEXT_PLAIN, body.getBytes(StandardCharsets.UTF_8));
    }

    public static HandlerResult json(byte[] body) {
        return new HandlerResult(200, APPLICATION_JSON, body);
    }
}
