package com.imdsguard.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imdsguard.api.CredentialsProvider;
import com.imdsguard.api.RoleFinder;
import com.imdsguard.server.forward.HttpClientMetadataForwarder;
import com.imdsguard.server.forward.MetadataForwarder;
import com.imdsguard.server.guard.RequestLifecycleGuard;
import com.imdsguard.server.guard.ResponseMetrics;
import com.imdsguard.server.handler.CredentialsHandler;
import com.imdsguard.server.handler.HealthProbe;
import com.imdsguard.server.handler.RoleAuthorizer;
import com.imdsguard.server.handler.RoleHandler;
import com.imdsguard.server.identity.ClientIdentityResolver;
import com.imdsguard.server.web.CanonicalPathFilter;
import com.imdsguard.server.web.OperationsController;
import com.imdsguard.server.web.PassthroughController;
import com.imdsguard.server.web.ProxyErrorHandler;
import com.imdsguard.server.web.RequestLoggingFilter;
import com.imdsguard.server.web.SecurityCredentialsController;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.web.servlet.error.ErrorMvcAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Application context of one {@link MetadataServer}. {@link ServerConfig}, {@link RoleFinder} and
 * {@link CredentialsProvider} are registered by the server before refresh.
 *
 * <p>The Boot error controller is excluded: {@code /error} is an ordinary path and goes to the passthrough like
 * any other unclaimed path.
 */
@SpringBootConfiguration
@EnableAutoConfiguration(exclude = ErrorMvcAutoConfiguration.class)
@Import({
    SecurityCredentialsController.class,
    OperationsController.class,
    PassthroughController.class,
    ProxyErrorHandler.class
})
public class MetadataProxyConfiguration {

    @Bean
    public PrometheusMeterRegistry meterRegistry() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Bean
    public ResponseMetrics responseMetrics(PrometheusMeterRegistry meterRegistry) {
        return new ResponseMetrics(meterRegistry);
    }

    @Bean
    public ClientIdentityResolver clientIdentityResolver(ServerConfig config) {
        return new ClientIdentityResolver(config.allowIpQuery());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService handlerExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("imdsguard-handler-"));
    }

    @Bean
    public RequestLifecycleGuard requestLifecycleGuard(
            ClientIdentityResolver clientIdentityResolver,
            ResponseMetrics responseMetrics,
            ExecutorService handlerExecutor,
            ServerConfig config) {
        return new RequestLifecycleGuard(
                clientIdentityResolver, responseMetrics, handlerExecutor, config.maxHandlerDuration());
    }

    @Bean
    public HttpClient metadataHttpClient(ServerConfig config) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.upstreamTimeout())
                .build();
    }

    @Bean
    public RoleAuthorizer roleAuthorizer(RoleFinder roleFinder) {
        return new RoleAuthorizer(roleFinder);
    }

    @Bean
    public RoleHandler roleHandler(RoleAuthorizer roleAuthorizer) {
        return new RoleHandler(roleAuthorizer);
    }

    @Bean
    public CredentialsHandler credentialsHandler(
            RoleAuthorizer roleAuthorizer, CredentialsProvider credentialsProvider, ObjectMapper objectMapper) {
        return new CredentialsHandler(roleAuthorizer, credentialsProvider, objectMapper);
    }

    @Bean
    public HealthProbe healthProbe(HttpClient metadataHttpClient, ServerConfig config) {
        return new HealthProbe(metadataHttpClient, config.metadataUri(), config.upstreamTimeout());
    }

    @Bean
    public MetadataForwarder metadataForwarder(HttpClient metadataHttpClient, ServerConfig config) {
        return new HttpClientMetadataForwarder(metadataHttpClient, config.metadataUri(), config.upstreamTimeout());
    }

    @Bean
    public CanonicalPathFilter canonicalPathFilter() {
        return new CanonicalPathFilter();
    }

    @Bean
    public RequestLoggingFilter requestLoggingFilter() {
        return new RequestLoggingFilter();
    }
}
