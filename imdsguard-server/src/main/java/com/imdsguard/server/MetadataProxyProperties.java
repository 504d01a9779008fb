package com.imdsguard.server;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;

/**
 * Externalized configuration of the proxy.
 *
 * <pre>{@code
 * imdsguard:
 *   server:
 *     listen-port: 8181
 *     metadata-endpoint: http://169.254.169.254
 *     allow-ip-query: false
 *     max-handler-duration: 5s
 * }</pre>
 *
 * <p>A bootstrapper binds these from its own {@link Environment} with {@link #bind(Environment)} and passes the
 * resulting {@link ServerConfig} to {@link MetadataServer}.
 */
@ConfigurationProperties(prefix = MetadataProxyProperties.PREFIX)
public class MetadataProxyProperties {

    public static final String PREFIX = "imdsguard.server";

    private int listenPort = 8181;
    private String metadataEndpoint = ServerConfig.DEFAULT_METADATA_ENDPOINT;
    private boolean allowIpQuery;
    private Duration maxHandlerDuration = ServerConfig.DEFAULT_MAX_HANDLER_DURATION;
    private Duration drainTimeout = ServerConfig.DEFAULT_DRAIN_TIMEOUT;
    private Duration upstreamTimeout = ServerConfig.DEFAULT_UPSTREAM_TIMEOUT;

    public static MetadataProxyProperties bind(Environment environment) {
        return Binder.get(environment).bind(PREFIX, MetadataProxyProperties.class).orElseGet(MetadataProxyProperties::new);
    }

    public ServerConfig toServerConfig() {
        return ServerConfig.builder()
                .listenPort(listenPort)
                .metadataEndpoint(metadataEndpoint)
                .allowIpQuery(allowIpQuery)
                .maxHandlerDuration(maxHandlerDuration)
                .drainTimeout(drainTimeout)
                .upstreamTimeout(upstreamTimeout)
                .build();
    }

    public int getListenPort() {
        return listenPort;
    }

    public void setListenPort(int listenPort) {
        this.listenPort = listenPort;
    }

    public String getMetadataEndpoint() {
        return metadataEndpoint;
    }

    public void setMetadataEndpoint(String metadataEndpoint) {
        this.metadataEndpoint = metadataEndpoint;
    }

    public boolean isAllowIpQuery() {
        return allowIpQuery;
    }

    public void setAllowIpQuery(boolean allowIpQuery) {
        this.allowIpQuery = allowIpQuery;
    }

    public Duration getMaxHandlerDuration() {
        return maxHandlerDuration;
    }

    public void setMaxHandlerDuration(Duration maxHandlerDuration) {
        this.maxHandlerDuration = maxHandlerDuration;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Duration getUpstreamTimeout() {
        return upstreamTimeout;
    }

    public void setUpstreamTimeout(Duration upstreamTimeout) {
        this.upstreamTimeout = upstreamTimeout;
    }
}
