package com.imdsguard.server.forward;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link MetadataForwarder} on the JDK {@link HttpClient}. */
public class HttpClientMetadataForwarder implements MetadataForwarder {

    private static final Logger log = LoggerFactory.getLogger(HttpClientMetadataForwarder.class);

    /** Connection-scoped headers, never relayed in either direction. */
    static final Set<String> HOP_BY_HOP = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    /** Largest request body relayed upstream; metadata requests carry at most a few bytes. */
    static final int MAX_REQUEST_BODY_BYTES = 64 * 1024;

    /** Set by the HTTP client from the target URI and body. */
    static final Set<String> CLIENT_MANAGED = Set.of("host", "content-length", "expect");

    private final HttpClient client;
    private final URI upstream;
    private final Duration timeout;

    public HttpClientMetadataForwarder(HttpClient client, URI upstream, Duration timeout) {
        this.client = client;
        this.upstream = upstream;
        this.timeout = timeout;
    }

    @Override
    public void forward(HttpServletRequest request, HttpServletResponse response) throws IOException {
        URI target;
        try {
            target = targetUri(request);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot forward malformed request URI {}: {}", request.getRequestURI(), e.getMessage());
            writeGatewayError(response, HttpServletResponse.SC_BAD_REQUEST, "malformed request");
            return;
        }

        byte[] body = readBody(request);
        if (body == null) {
            log.warn(
                    "Request body over {} bytes: method={}, path={}",
                    MAX_REQUEST_BODY_BYTES,
                    request.getMethod(),
                    request.getRequestURI());
            writeGatewayError(response, HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE, "request body too large");
            return;
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(target)
                .timeout(timeout)
                .method(
                        request.getMethod(),
                        body.length == 0
                                ? HttpRequest.BodyPublishers.noBody()
                                : HttpRequest.BodyPublishers.ofByteArray(body));
        copyRequestHeaders(request, builder);

        HttpResponse<InputStream> upstreamResponse;
        try {
            upstreamResponse = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            log.warn("Metadata endpoint timed out: method={}, target={}", request.getMethod(), target);
            writeGatewayError(response, HttpServletResponse.SC_GATEWAY_TIMEOUT, "metadata endpoint timed out");
            return;
        } catch (IOException e) {
            log.warn("Metadata endpoint unreachable: method={}, target={}", request.getMethod(), target, e);
            writeGatewayError(response, HttpServletResponse.SC_BAD_GATEWAY, "metadata endpoint unreachable");
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writeGatewayError(response, HttpServletResponse.SC_BAD_GATEWAY, "request interrupted");
            return;
        }

        relay(upstreamResponse, response);
    }

    URI targetUri(HttpServletRequest request) {
        StringBuilder uri = new StringBuilder(upstream.getScheme())
                .append("://")
                .append(upstream.getRawAuthority());
        String basePath = upstream.getRawPath();
        if (basePath != null && !basePath.equals("/")) {
            uri.append(basePath);
        }
        uri.append(request.getRequestURI());
        String query = request.getQueryString();
        if (query != null) {
            uri.append('?').append(query);
        }
        return URI.create(uri.toString());
    }

    /** The request body, or {@code null} when it exceeds {@link #MAX_REQUEST_BODY_BYTES}. */
    private static byte[] readBody(HttpServletRequest request) throws IOException {
        if (request.getContentLengthLong() > MAX_REQUEST_BODY_BYTES) {
            return null;
        }
        byte[] body = request.getInputStream().readNBytes(MAX_REQUEST_BODY_BYTES + 1);
        return body.length > MAX_REQUEST_BODY_BYTES ? null : body;
    }

    private static void copyRequestHeaders(HttpServletRequest request, HttpRequest.Builder builder) {
        for (String name : Collections.list(request.getHeaderNames())) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP.contains(lower) || CLIENT_MANAGED.contains(lower)) {
                continue;
            }
            for (String value : Collections.list(request.getHeaders(name))) {
                try {
                    builder.header(name, value);
                } catch (IllegalArgumentException e) {
                    log.debug("Dropping header {} the HTTP client refuses: {}", name, e.getMessage());
                }
            }
        }
    }

    private static void relay(HttpResponse<InputStream> upstreamResponse, HttpServletResponse response)
            throws IOException {
        response.setStatus(upstreamResponse.statusCode());
        for (Map.Entry<String, List<String>> header :
                upstreamResponse.headers().map().entrySet()) {
            String name = header.getKey();
            if (name.startsWith(":") || HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String value : header.getValue()) {
                response.addHeader(name, value);
            }
        }
        try (InputStream in = upstreamResponse.body()) {
            in.transferTo(response.getOutputStream());
        }
    }

    private static void writeGatewayError(HttpServletResponse response, int status, String message)
            throws IOException {
        byte[] body = (message + "\n").getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setContentType("text/plain;charset=UTF-8");
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }
}
