package com.imdsguard.server;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;
import lombok.Builder;

/**
 * Immutable settings of one {@link MetadataServer}.
 *
 * @param listenPort port the proxy listens on, {@code 0} picks a free port
 * @param metadataEndpoint base URL of the real instance-metadata service
 * @param allowIpQuery honor the {@code ip} request parameter as the caller identity; never enable in production
 * @param maxHandlerDuration deadline applied to every guarded handler invocation
 * @param drainTimeout upper bound for the graceful drain on {@link MetadataServer#stop(Duration)}
 * @param upstreamTimeout connect and response timeout for calls to the metadata endpoint
 */
@Builder(toBuilder = true)
public record ServerConfig(
        int listenPort,
        String metadataEndpoint,
        boolean allowIpQuery,
        Duration maxHandlerDuration,
        Duration drainTimeout,
        Duration upstreamTimeout) {

    public static final String DEFAULT_METADATA_ENDPOINT = "http://169.254.169.254";
    public static final Duration DEFAULT_MAX_HANDLER_DURATION = Duration.ofSeconds(5);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_UPSTREAM_TIMEOUT = Duration.ofSeconds(5);

    public ServerConfig {
        if (listenPort < 0 || listenPort > 65535) {
            throw new IllegalArgumentException("listenPort out of range: " + listenPort);
        }
        Objects.requireNonNull(metadataEndpoint, "metadataEndpoint");
        metadataEndpoint = stripTrailingSlash(metadataEndpoint);
        URI uri = parse(metadataEndpoint);
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("metadataEndpoint must be an absolute http(s) URL: " + metadataEndpoint);
        }
        requirePositive(maxHandlerDuration, "maxHandlerDuration");
        requirePositive(drainTimeout, "drainTimeout");
        requirePositive(upstreamTimeout, "upstreamTimeout");
    }

    /** Production defaults: real metadata endpoint, identity override disabled. */
    public static ServerConfig defaults(int listenPort) {
        return ServerConfig.builder()
                .listenPort(listenPort)
                .metadataEndpoint(DEFAULT_METADATA_ENDPOINT)
                .allowIpQuery(false)
                .maxHandlerDuration(DEFAULT_MAX_HANDLER_DURATION)
                .drainTimeout(DEFAULT_DRAIN_TIMEOUT)
                .upstreamTimeout(DEFAULT_UPSTREAM_TIMEOUT)
                .build();
    }

    public URI metadataUri() {
        return URI.create(metadataEndpoint);
    }

    private static URI parse(String endpoint) {
        try {
            return new URI(endpoint);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("metadataEndpoint is not a valid URL: " + endpoint, e);
        }
    }

    private static String stripTrailingSlash(String endpoint) {
        String trimmed = endpoint.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
