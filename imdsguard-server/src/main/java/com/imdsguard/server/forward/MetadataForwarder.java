package com.imdsguard.server.forward;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Relays a request the proxy does not intercept to the real metadata endpoint and copies the answer back.
 *
 * <p>Upstream failures are answered with a gateway status, never thrown; an {@link IOException} means the
 * caller's own connection broke.
 */
public interface MetadataForwarder {

    void forward(HttpServletRequest request, HttpServletResponse response) throws IOException;
}
