package com.imdsguard.server;

import com.imdsguard.api.CredentialsProvider;
import com.imdsguard.api.RoleFinder;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.web.server.WebServer;
import org.springframework.boot.web.server.WebServerException;
import org.springframework.boot.web.servlet.context.ServletWebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.MapPropertySource;

/**
 * Owns the listening socket of one proxy instance.
 *
 * <p>{@link #serve()} blocks the calling thread for the lifetime of the server; {@link #stop(Duration)} is meant
 * to be called from another thread, typically a process supervisor reacting to a termination signal. The lock
 * guards only state transitions, never startup or the drain itself.
 */
@Slf4j
public class MetadataServer {

    private final ServerConfig config;
    private final RoleFinder roleFinder;
    private final CredentialsProvider credentialsProvider;

    private final ReentrantLock lock = new ReentrantLock();
    private ServerState state = ServerState.IDLE;
    private boolean serveCalled;
    private ServerRuntime runtime;
    private Duration pendingStop;

    public MetadataServer(ServerConfig config, RoleFinder roleFinder, CredentialsProvider credentialsProvider) {
        this.config = config;
        this.roleFinder = roleFinder;
        this.credentialsProvider = credentialsProvider;
    }

    /**
     * Binds the listen port and serves until {@link #stop(Duration)} has drained the server.
     *
     * @throws WebServerException when the port cannot be bound
     * @throws IllegalStateException when called more than once
     */
    public void serve() {
        lock.lock();
        try {
            if (serveCalled) {
                throw new IllegalStateException("serve() already called, state=" + state);
            }
            serveCalled = true;
            state = ServerState.STARTING;
        } finally {
            lock.unlock();
        }

        ConfigurableApplicationContext context;
        try {
            context = application().run();
        } catch (RuntimeException e) {
            transition(ServerState.STOPPED);
            throw listenFailure(e);
        }

        ServerRuntime started = new ServerRuntime(context);
        Duration stopRequested;
        lock.lock();
        try {
            runtime = started;
            state = ServerState.RUNNING;
            stopRequested = pendingStop;
        } finally {
            lock.unlock();
        }
        log.info("listening :{}", started.port());
        if (stopRequested != null) {
            log.info("stop requested during startup");
            stop(stopRequested);
            return;
        }

        try {
            started.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("serve() interrupted, shutting down");
            stop(config.drainTimeout());
        }
    }

    /**
     * Stops accepting connections, lets in-flight requests finish for at most {@code timeout} (capped at the
     * configured drain timeout), then closes whatever is left. A no-op when {@link #serve()} was never called, and
     * on a second call. While the server is still starting, the stop is recorded and {@link #serve()} drains as
     * soon as the socket is bound.
     */
    public void stop(Duration timeout) {
        ServerRuntime draining;
        lock.lock();
        try {
            if (state == ServerState.STARTING) {
                pendingStop = timeout;
                log.info("stop requested while starting, will drain once bound");
                return;
            }
            if (state != ServerState.RUNNING) {
                return;
            }
            state = ServerState.DRAINING;
            draining = runtime;
        } finally {
            lock.unlock();
        }

        Duration bounded = timeout.compareTo(config.drainTimeout()) < 0 ? timeout : config.drainTimeout();
        log.info("starting server shutdown, drain timeout {}", bounded);
        try {
            draining.drain(bounded);
        } finally {
            lock.lock();
            try {
                state = ServerState.STOPPED;
                runtime = null;
            } finally {
                lock.unlock();
            }
        }
        log.info("gracefully shutdown server");
    }

    public ServerState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Port actually bound, or {@code -1} when not running. */
    public int port() {
        lock.lock();
        try {
            return runtime != null ? runtime.port() : -1;
        } finally {
            lock.unlock();
        }
    }

    public ServerConfig config() {
        return config;
    }

    private SpringApplication application() {
        SpringApplication application = new SpringApplication(MetadataProxyConfiguration.class);
        application.setWebApplicationType(WebApplicationType.SERVLET);
        application.setRegisterShutdownHook(false);
        application.addInitializers(context -> {
            context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("imdsguardServer", serverProperties()));
            context.getBeanFactory().registerSingleton("serverConfig", config);
            context.getBeanFactory().registerSingleton("roleFinder", roleFinder);
            context.getBeanFactory().registerSingleton("credentialsProvider", credentialsProvider);
        });
        return application;
    }

    Map<String, Object> serverProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("server.port", config.listenPort());
        properties.put("server.shutdown", "graceful");
        properties.put("spring.lifecycle.timeout-per-shutdown-phase", config.drainTimeout().toMillis() + "ms");
        properties.put("spring.main.banner-mode", "off");
        properties.put("spring.jmx.enabled", false);
        // PUT/PATCH form bodies must reach the passthrough untouched
        properties.put("spring.mvc.formcontent.filter.enabled", false);
        properties.put("spring.web.resources.add-mappings", false);
        return properties;
    }

    private void transition(ServerState next) {
        lock.lock();
        try {
            state = next;
        } finally {
            lock.unlock();
        }
    }

    private static RuntimeException listenFailure(RuntimeException failure) {
        Throwable cause = failure;
        while (cause != null) {
            if (cause instanceof WebServerException webServerException) {
                return webServerException;
            }
            cause = cause.getCause();
        }
        return failure;
    }

    /** The running context and its embedded web server. Used once, then abandoned. */
    private static final class ServerRuntime {

        private final ConfigurableApplicationContext context;
        private final WebServer webServer;
        private final CountDownLatch terminated = new CountDownLatch(1);

        ServerRuntime(ConfigurableApplicationContext context) {
            this.context = context;
            this.webServer = ((ServletWebServerApplicationContext) context).getWebServer();
        }

        int port() {
            return webServer.getPort();
        }

        void awaitTermination() throws InterruptedException {
            terminated.await();
        }

        void drain(Duration timeout) {
            CountDownLatch drained = new CountDownLatch(1);
            try {
                webServer.shutDownGracefully(result -> {
                    log.debug("graceful shutdown result {}", result);
                    drained.countDown();
                });
                if (!drained.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("drain timeout {} exceeded, closing remaining connections", timeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("drain interrupted, closing remaining connections");
            } finally {
                try {
                    webServer.stop();
                } catch (WebServerException e) {
                    log.warn("error stopping web server", e);
                }
                context.close();
                terminated.countDown();
            }
        }
    }
}
