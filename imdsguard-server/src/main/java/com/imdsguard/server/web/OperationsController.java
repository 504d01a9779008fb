package com.imdsguard.server.web;

import com.imdsguard.server.guard.RequestLifecycleGuard;
import com.imdsguard.server.handler.HealthProbe;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness, upstream health and metrics exposition. */
@RestController
public class OperationsController {

    static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType("text/plain;version=0.0.4;charset=utf-8");

    private final RequestLifecycleGuard guard;
    private final HealthProbe healthProbe;
    private final PrometheusMeterRegistry meterRegistry;

    public OperationsController(
            RequestLifecycleGuard guard, HealthProbe healthProbe, PrometheusMeterRegistry meterRegistry) {
        this.guard = guard;
        this.healthProbe = healthProbe;
        this.meterRegistry = meterRegistry;
    }

    @RequestMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("pong");
    }

    @RequestMapping("/health")
    public void health(HttpServletRequest request, HttpServletResponse response) throws IOException {
        guard.execute(HealthProbe.NAME, request, response, healthProbe);
    }

    @RequestMapping("/metrics")
    public ResponseEntity<String> metrics() {
        return ResponseEntity.ok().contentType(PROMETHEUS_TEXT).body(meterRegistry.scrape());
    }
}
